package dev.metricfortune.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JobReport")
class JobReportTest {

    @Test
    @DisplayName("should split outcomes into results and site errors")
    void shouldFoldOutcomes() {
        JobReport<String> report = JobReport.fold("job", List.of(
                JobReport.Outcome.success("a"),
                JobReport.Outcome.<String>failure("site-2", new IllegalStateException("boom")),
                JobReport.Outcome.success("c")), System.currentTimeMillis());

        assertThat(report.failed()).isFalse();
        assertThat(report.results()).containsExactly("a", "c");
        assertThat(report.errors()).containsExactly(new JobReport.SiteError("site-2", "boom"));
        assertThat(report.processed()).isEqualTo(3);
        assertThat(report.executionTimeMs()).isNotNegative();
    }

    @Test
    @DisplayName("should fall back to the exception type when it has no message")
    void shouldUseExceptionTypeWithoutMessage() {
        JobReport.Outcome<String> outcome = JobReport.Outcome.failure("site-1", new NullPointerException());

        assertThat(outcome.error().message()).isEqualTo("NullPointerException");
        assertThat(outcome.result()).isNull();
    }

    @Test
    @DisplayName("should mark a run that never started as failed")
    void shouldBuildFailedReport() {
        JobReport<String> report = JobReport.failed("job", "db down", 12);

        assertThat(report.failed()).isTrue();
        assertThat(report.failureMessage()).isEqualTo("db down");
        assertThat(report.processed()).isZero();
    }
}
