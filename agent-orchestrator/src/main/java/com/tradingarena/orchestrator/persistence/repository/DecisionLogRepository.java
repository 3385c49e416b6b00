package com.tradingarena.orchestrator.persistence.repository;

import com.tradingarena.orchestrator.persistence.entity.DecisionLogEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface DecisionLogRepository extends ReactiveCrudRepository<DecisionLogEntity, Long> {

    Mono<Boolean> existsByDecisionId(String decisionId);
}
