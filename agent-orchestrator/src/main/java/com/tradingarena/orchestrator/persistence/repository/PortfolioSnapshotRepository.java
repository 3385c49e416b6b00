package com.tradingarena.orchestrator.persistence.repository;

import com.tradingarena.orchestrator.persistence.entity.PortfolioSnapshotEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PortfolioSnapshotRepository extends ReactiveCrudRepository<PortfolioSnapshotEntity, Long> {
}
