package dev.metricfortune.repository;

import dev.metricfortune.entity.Business;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface BusinessRepository extends ReactiveCrudRepository<Business, Long> {

    Mono<Business> findBySiteId(String siteId);

    Mono<Boolean> existsBySiteId(String siteId);

    Flux<Business> findByIndustry(String industry);

    @Query("SELECT * FROM businesses WHERE industry = :industry AND id <> :excludeId")
    Flux<Business> findIndustryPeers(String industry, Long excludeId);

    @Query("SELECT site_id FROM businesses ORDER BY id")
    Flux<String> findAllSiteIds();

    @Modifying
    @Query("UPDATE businesses SET peer_group_id = :peerGroupId WHERE id = :businessId")
    Mono<Long> assignPeerGroup(Long businessId, Long peerGroupId);
}
