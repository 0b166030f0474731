package com.identityplatform.orchestrator.trace;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.identityplatform.common.model.ServiceId;
import com.identityplatform.common.model.ServiceResult;
import com.identityplatform.common.model.VerifierPayload;
import com.identityplatform.common.trace.RequestTraceContext;
import com.identityplatform.orchestrator.dto.ServiceOutcomeDTO;
import com.identityplatform.orchestrator.model.IdentificationTrace;
import com.identityplatform.orchestrator.repository.IdentificationTraceRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Persists one {@link IdentificationTrace} per orchestration request.
 *
 * <p>Fire-and-forget: {@link #record} returns immediately and the response never waits on the
 * database. A write that fails or exceeds the persist timeout is logged at WARN and counted
 * on {@value #FAILURE_COUNTER}; it is never retried.
 */
@Component
public class TraceRecorder {

    private static final Logger log = LoggerFactory.getLogger(TraceRecorder.class);

    public static final String FAILURE_COUNTER = "identity.trace.persist.failures";

    private final IdentificationTraceRepository repository;
    private final ObjectMapper objectMapper;
    private final Duration persistTimeout;
    private final Counter failureCounter;

    public TraceRecorder(IdentificationTraceRepository repository,
                         ObjectMapper objectMapper,
                         MeterRegistry meterRegistry,
                         @Value("${identity.trace.persist-timeout:5s}") Duration persistTimeout) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.persistTimeout = persistTimeout;
        this.failureCounter = Counter.builder(FAILURE_COUNTER)
            .description("Identification traces that could not be persisted")
            .register(meterRegistry);
    }

    public void record(TraceSnapshot snapshot) {
        persist(snapshot).subscribe();
    }

    /**
     * The write pipeline behind {@link #record}. Completes empty on failure.
     */
    Mono<IdentificationTrace> persist(TraceSnapshot snapshot) {
        return Mono.fromCallable(() -> toEntity(snapshot))
            .flatMap(repository::save)
            .timeout(persistTimeout)
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(saved -> {
                if (saved != null) {
                    log.debug("Trace persisted. requestId={} id={}", snapshot.requestId(), saved.getId());
                }
            })
            .onErrorResume(e -> {
                failureCounter.increment();
                RequestTraceContext.withMdc(snapshot.requestId(), () ->
                    log.warn("Trace persistence failed. requestId={} error={}",
                             snapshot.requestId(), e.toString())
                );
                return Mono.empty();
            });
    }

    IdentificationTrace toEntity(TraceSnapshot snapshot) throws JsonProcessingException {
        IdentificationTrace trace = new IdentificationTrace();
        trace.setRequestId(snapshot.requestId());
        trace.setRecordedAt(LocalDateTime.ofInstant(snapshot.recordedAt(), ZoneOffset.UTC));

        trace.setQuery(snapshot.request().query());
        trace.setProvider(snapshot.request().provider());
        trace.setImageFilename(snapshot.request().imageFilename());
        trace.setImageSizeBytes(snapshot.request().image().length);

        trace.setOutcome(snapshot.decision().outcome().name());
        trace.setReason(snapshot.decision().reason().code());
        trace.setSuccessfulServices(snapshot.decision().successfulServices());
        trace.setConfidence(snapshot.decision().confidence());

        ServiceResult verifier = snapshot.resultSet().get(ServiceId.VERIFIER);
        if (verifier != null) {
            trace.setVerifierStatus(verifier.status().name());
            trace.setVerifierLatencyMs(verifier.latencyMs());
            VerifierPayload payload = verifier.payloadAs(VerifierPayload.class);
            if (payload != null) {
                trace.setPersonId(payload.personId());
            }
        }

        ServiceResult chatbot = snapshot.resultSet().get(ServiceId.CHATBOT);
        if (chatbot != null) {
            trace.setChatbotStatus(chatbot.status().name());
            trace.setChatbotLatencyMs(chatbot.latencyMs());
        }

        trace.setAnswer(snapshot.answer());
        trace.setResultSet(objectMapper.writeValueAsString(
            ServiceOutcomeDTO.disclosed(snapshot.resultSet(), snapshot.decision())));
        trace.setThreshold(snapshot.config().threshold());
        trace.setMargin(snapshot.config().margin());
        trace.setFusionMethod(snapshot.config().method().name());
        trace.setProcessingTimeMs(snapshot.processingTimeMs());
        return trace;
    }
}
