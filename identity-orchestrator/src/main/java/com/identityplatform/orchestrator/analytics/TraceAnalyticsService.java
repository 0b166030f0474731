package com.identityplatform.orchestrator.analytics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.identityplatform.common.model.DecisionOutcome;
import com.identityplatform.common.model.ServiceId;
import com.identityplatform.common.model.ServiceStatus;
import com.identityplatform.orchestrator.dto.IdentificationRateDTO;
import com.identityplatform.orchestrator.dto.QueryStatisticsDTO;
import com.identityplatform.orchestrator.dto.ServiceStatisticsDTO;
import com.identityplatform.orchestrator.dto.TraceRecordDTO;
import com.identityplatform.orchestrator.model.IdentificationTrace;
import com.identityplatform.orchestrator.repository.IdentificationTraceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.DoubleSummaryStatistics;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.LongSummaryStatistics;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Read-only aggregations over persisted identification traces.
 *
 * <p>Traces are not unique per request id. Every aggregation keeps only the most recent
 * trace of each request id before counting.
 */
@Service
public class TraceAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(TraceAnalyticsService.class);

    private final IdentificationTraceRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TraceAnalyticsService(IdentificationTraceRepository repository,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Mono<IdentificationRateDTO> getIdentificationRate(TimeRange range) {
        return tracesWithin(range)
            .collectList()
            .map(traces -> toIdentificationRate(range, traces))
            .doOnNext(dto -> log.info("Identification rate computed. range={} total={} rate={}",
                                      range.label(), dto.total(), dto.identificationRate()));
    }

    public Mono<QueryStatisticsDTO> getQueryStatistics(TimeRange range) {
        return tracesWithin(range)
            .collectList()
            .map(traces -> toQueryStatistics(range, traces))
            .doOnNext(dto -> log.info("Query statistics computed. range={} totalQueries={}",
                                      range.label(), dto.totalQueries()));
    }

    public Mono<TraceRecordDTO> getLatestTrace() {
        return repository.findFirstByOrderByRecordedAtDesc()
            .map(this::toRecord);
    }

    public Flux<TraceRecordDTO> getTraces(String requestId) {
        return repository.findByRequestIdOrderByRecordedAtDesc(requestId)
            .map(this::toRecord);
    }

    // ── aggregation ──

    Flux<IdentificationTrace> tracesWithin(TimeRange range) {
        LocalDateTime since = LocalDateTime.ofInstant(clock.instant().minus(range.duration()), ZoneOffset.UTC);
        return repository.findByRecordedAtGreaterThanEqualOrderByRecordedAtDesc(since)
            .distinct(IdentificationTrace::getRequestId);
    }

    private IdentificationRateDTO toIdentificationRate(TimeRange range, List<IdentificationTrace> traces) {
        long total = traces.size();
        long identified = traces.stream()
            .filter(t -> DecisionOutcome.MATCH.name().equals(t.getOutcome()))
            .count();

        DoubleSummaryStatistics confidence = traces.stream()
            .map(IdentificationTrace::getConfidence)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .summaryStatistics();
        boolean anyConfidence = confidence.getCount() > 0;

        Map<String, Long> outcomes = new LinkedHashMap<>();
        for (DecisionOutcome outcome : DecisionOutcome.values()) {
            outcomes.put(outcome.name(), countBy(traces, IdentificationTrace::getOutcome, outcome.name()));
        }

        return new IdentificationRateDTO(
            range.label(),
            total,
            identified,
            total - identified,
            total == 0 ? 0.0 : (double) identified / total,
            anyConfidence ? confidence.getAverage() : 0.0,
            anyConfidence ? confidence.getMin() : 0.0,
            anyConfidence ? confidence.getMax() : 0.0,
            outcomes);
    }

    private QueryStatisticsDTO toQueryStatistics(TimeRange range, List<IdentificationTrace> traces) {
        LongSummaryStatistics processing = traces.stream()
            .map(IdentificationTrace::getProcessingTimeMs)
            .filter(Objects::nonNull)
            .mapToLong(Long::longValue)
            .summaryStatistics();
        boolean anyProcessing = processing.getCount() > 0;

        Map<ServiceId, ServiceStatisticsDTO> services = new EnumMap<>(ServiceId.class);
        services.put(ServiceId.VERIFIER, serviceStatistics(traces,
            IdentificationTrace::getVerifierStatus, IdentificationTrace::getVerifierLatencyMs));
        services.put(ServiceId.CHATBOT, serviceStatistics(traces,
            IdentificationTrace::getChatbotStatus, IdentificationTrace::getChatbotLatencyMs));

        return new QueryStatisticsDTO(
            range.label(),
            traces.size(),
            anyProcessing ? processing.getAverage() : 0.0,
            anyProcessing ? processing.getMin() : 0L,
            anyProcessing ? processing.getMax() : 0L,
            services);
    }

    private ServiceStatisticsDTO serviceStatistics(List<IdentificationTrace> traces,
                                                   Function<IdentificationTrace, String> status,
                                                   Function<IdentificationTrace, Long> latency) {
        long calls = traces.size();
        long successes = countBy(traces, status, ServiceStatus.SUCCESS.name());
        long missed = traces.stream().filter(t -> status.apply(t) == null).count();

        Map<String, Long> statuses = new TreeMap<>();
        traces.stream()
            .map(status)
            .filter(Objects::nonNull)
            .forEach(s -> statuses.merge(s, 1L, Long::sum));

        double avgLatency = traces.stream()
            .filter(t -> status.apply(t) != null)
            .map(latency)
            .filter(Objects::nonNull)
            .mapToLong(Long::longValue)
            .average()
            .orElse(0.0);

        return new ServiceStatisticsDTO(
            calls,
            successes,
            missed,
            calls == 0 ? 0.0 : (double) successes / calls,
            avgLatency,
            statuses);
    }

    private static long countBy(List<IdentificationTrace> traces,
                                Function<IdentificationTrace, String> field,
                                String value) {
        return traces.stream().filter(t -> value.equals(field.apply(t))).count();
    }

    // ── record view ──

    private TraceRecordDTO toRecord(IdentificationTrace trace) {
        return new TraceRecordDTO(
            trace.getRequestId(),
            trace.getRecordedAt(),
            trace.getQuery(),
            trace.getProvider(),
            trace.getImageFilename(),
            trace.getOutcome(),
            trace.getReason(),
            trace.getSuccessfulServices(),
            trace.getConfidence(),
            trace.getPersonId(),
            trace.getAnswer(),
            parseResultSet(trace),
            trace.getThreshold(),
            trace.getMargin(),
            trace.getFusionMethod(),
            trace.getProcessingTimeMs());
    }

    private JsonNode parseResultSet(IdentificationTrace trace) {
        if (trace.getResultSet() == null) return null;
        try {
            return objectMapper.readTree(trace.getResultSet());
        } catch (JsonProcessingException e) {
            log.warn("Stored result set is not valid JSON. requestId={} id={}", trace.getRequestId(), trace.getId());
            return objectMapper.getNodeFactory().textNode(trace.getResultSet());
        }
    }
}
