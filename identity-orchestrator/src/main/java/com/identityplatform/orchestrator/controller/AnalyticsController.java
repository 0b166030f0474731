package com.identityplatform.orchestrator.controller;

import com.identityplatform.orchestrator.analytics.TimeRange;
import com.identityplatform.orchestrator.analytics.TraceAnalyticsService;
import com.identityplatform.orchestrator.dto.IdentificationRateDTO;
import com.identityplatform.orchestrator.dto.QueryStatisticsDTO;
import com.identityplatform.orchestrator.dto.TraceRecordDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read-only views over persisted identification traces.
 */
@RestController
@RequestMapping("/api/v1")
public class AnalyticsController {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsController.class);

    private final TraceAnalyticsService analyticsService;

    public AnalyticsController(TraceAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/metrics/identification-rate")
    public Mono<ResponseEntity<IdentificationRateDTO>> identificationRate(
            @RequestParam(name = "time_range", defaultValue = "24h") String timeRange) {
        log.info("Identification rate query received. timeRange={}", timeRange);
        return analyticsService.getIdentificationRate(TimeRange.fromLabel(timeRange))
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Identification rate endpoint error. timeRange={}", timeRange, e));
    }

    @GetMapping("/metrics/query-statistics")
    public Mono<ResponseEntity<QueryStatisticsDTO>> queryStatistics(
            @RequestParam(name = "time_range", defaultValue = "24h") String timeRange) {
        log.info("Query statistics query received. timeRange={}", timeRange);
        return analyticsService.getQueryStatistics(TimeRange.fromLabel(timeRange))
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Query statistics endpoint error. timeRange={}", timeRange, e));
    }

    @GetMapping("/traces/latest")
    public Mono<ResponseEntity<TraceRecordDTO>> latestTrace() {
        log.info("Latest trace query received");
        return analyticsService.getLatestTrace()
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/traces/{requestId}")
    public Flux<TraceRecordDTO> traces(@PathVariable String requestId) {
        log.info("Trace lookup received. requestId={}", requestId);
        return analyticsService.getTraces(requestId);
    }
}
