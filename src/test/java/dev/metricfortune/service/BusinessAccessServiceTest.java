package dev.metricfortune.service;

import dev.metricfortune.config.ResilienceConfig;
import dev.metricfortune.entity.Business;
import dev.metricfortune.exception.ResourceNotFoundException;
import dev.metricfortune.repository.BusinessRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BusinessAccessServiceTest {

    @Mock private BusinessRepository businessRepository;

    private BusinessAccessService accessService;

    @BeforeEach
    void setUp() {
        accessService = new BusinessAccessService(businessRepository, new ResilienceConfig(10, 3, 100, 1000, 5));
    }

    @Test
    @DisplayName("Should return the business to its owner")
    void shouldReturnOwnedBusiness() {
        Business business = Business.builder().id(1L).userId("owner").build();
        when(businessRepository.findById(1L)).thenReturn(Mono.just(business));

        StepVerifier.create(accessService.requireOwned(1L, "owner"))
                .expectNext(business)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should report another owner's business as not found")
    void shouldHideForeignBusiness() {
        when(businessRepository.findById(1L)).thenReturn(Mono.just(Business.builder().id(1L).userId("owner").build()));

        StepVerifier.create(accessService.requireOwned(1L, "intruder"))
                .expectErrorMatches(e -> e instanceof ResourceNotFoundException
                        && e.getMessage().equals("error.business_not_found"))
                .verify();
    }

    @Test
    @DisplayName("Should report a missing business as not found")
    void shouldReportMissingBusiness() {
        when(businessRepository.findById(2L)).thenReturn(Mono.empty());

        StepVerifier.create(accessService.requireOwned(2L, "owner"))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    @DisplayName("Should not query without a caller")
    void shouldRejectMissingCaller() {
        StepVerifier.create(accessService.requireOwned(1L, " "))
                .expectError(ResourceNotFoundException.class)
                .verify();

        verifyNoInteractions(businessRepository);
    }
}
