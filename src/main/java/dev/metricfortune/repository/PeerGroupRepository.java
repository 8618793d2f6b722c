package dev.metricfortune.repository;

import dev.metricfortune.entity.PeerGroup;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PeerGroupRepository extends ReactiveCrudRepository<PeerGroup, Long> {
}
