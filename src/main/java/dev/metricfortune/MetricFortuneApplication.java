package dev.metricfortune;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MetricFortuneApplication {

    public static void main(String[] args) {
        SpringApplication.run(MetricFortuneApplication.class, args);
    }
}
