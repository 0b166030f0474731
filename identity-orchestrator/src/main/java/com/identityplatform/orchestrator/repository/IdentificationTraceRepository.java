package com.identityplatform.orchestrator.repository;

import com.identityplatform.orchestrator.model.IdentificationTrace;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface IdentificationTraceRepository extends ReactiveCrudRepository<IdentificationTrace, Long> {

    Flux<IdentificationTrace> findByRequestIdOrderByRecordedAtDesc(String requestId);

    Mono<IdentificationTrace> findFirstByOrderByRecordedAtDesc();

    Flux<IdentificationTrace> findByRecordedAtGreaterThanEqualOrderByRecordedAtDesc(LocalDateTime since);
}
