package dev.metricfortune.service;

import dev.metricfortune.config.ResilienceConfig;
import dev.metricfortune.entity.Business;
import dev.metricfortune.exception.ResourceNotFoundException;
import dev.metricfortune.repository.BusinessRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Ownership gate for every business-scoped read and write. A business the caller does not own is
 * reported exactly like a missing one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BusinessAccessService {

    private final BusinessRepository businessRepository;
    private final ResilienceConfig resilience;

    public Mono<Business> requireOwned(Long businessId, String userId) {
        if (businessId == null || userId == null || userId.isBlank()) {
            return Mono.error(new ResourceNotFoundException("error.business_not_found"));
        }
        return businessRepository.findById(businessId)
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry())
                .filter(business -> {
                    boolean owned = Objects.equals(business.getUserId(), userId);
                    if (!owned) {
                        log.warn("User {} denied access to business {}", userId, businessId);
                    }
                    return owned;
                })
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("error.business_not_found")));
    }
}
