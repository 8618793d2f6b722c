package dev.metricfortune.repository;

import dev.metricfortune.entity.Pattern;
import reactor.core.publisher.Mono;

import java.util.List;

public interface PatternRepositoryCustom {

    /**
     * Multi-row insert that skips rows colliding on (site, type, key, window start).
     *
     * @return number of rows actually inserted
     */
    Mono<Long> insertAllSkipDuplicates(List<Pattern> patterns);
}
