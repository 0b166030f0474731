package com.identityplatform.orchestrator.analytics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.identityplatform.common.model.ServiceId;
import com.identityplatform.orchestrator.dto.IdentificationRateDTO;
import com.identityplatform.orchestrator.dto.QueryStatisticsDTO;
import com.identityplatform.orchestrator.dto.ServiceStatisticsDTO;
import com.identityplatform.orchestrator.model.IdentificationTrace;
import com.identityplatform.orchestrator.repository.IdentificationTraceRepository;
import com.identityplatform.orchestrator.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TraceAnalyticsServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");
    private static final LocalDateTime NOW_UTC = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private IdentificationTraceRepository repository;

    private TraceAnalyticsService service;

    @BeforeEach
    void setUp() {
        service = new TraceAnalyticsService(repository, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    /** Newest first, as the repository returns them; r1 was written twice. */
    private static Flux<IdentificationTrace> mixedTraces() {
        return Flux.just(
            Fixtures.trace("r3", NOW_UTC.minusMinutes(1), "UNKNOWN", null, "TRANSPORT_ERROR", null, 300),
            Fixtures.trace("r2", NOW_UTC.minusMinutes(5), "NO_MATCH", 0.4, "SUCCESS", "TIMEOUT", 800),
            Fixtures.trace("r1", NOW_UTC.minusMinutes(9), "MATCH", 0.9, "SUCCESS", "SUCCESS", 500),
            Fixtures.trace("r1", NOW_UTC.minusMinutes(10), "MATCH", 0.9, "SUCCESS", "SUCCESS", 500));
    }

    @Nested
    @DisplayName("identification rate")
    class IdentificationRate {

        @Test
        @DisplayName("mixed traces, duplicate request id counted once")
        void mixed() {
            when(repository.findByRecordedAtGreaterThanEqualOrderByRecordedAtDesc(NOW_UTC.minusHours(24)))
                .thenReturn(mixedTraces());

            IdentificationRateDTO rate = service.getIdentificationRate(TimeRange.LAST_DAY).block();

            assertNotNull(rate);
            assertEquals("24h", rate.timeRange());
            assertEquals(3, rate.total());
            assertEquals(1, rate.identified());
            assertEquals(2, rate.notIdentified());
            assertEquals(1.0 / 3, rate.identificationRate(), 1e-9);
            assertEquals(0.65, rate.avgConfidence(), 1e-9);
            assertEquals(0.4, rate.minConfidence(), 1e-9);
            assertEquals(0.9, rate.maxConfidence(), 1e-9);
            assertEquals(Map.of("MATCH", 1L, "NO_MATCH", 1L, "UNKNOWN", 1L), rate.outcomes());
        }

        @Test
        @DisplayName("empty range yields zeros")
        void empty() {
            when(repository.findByRecordedAtGreaterThanEqualOrderByRecordedAtDesc(NOW_UTC.minusHours(1)))
                .thenReturn(Flux.empty());

            IdentificationRateDTO rate = service.getIdentificationRate(TimeRange.LAST_HOUR).block();

            assertNotNull(rate);
            assertEquals(0, rate.total());
            assertEquals(0.0, rate.identificationRate());
            assertEquals(0.0, rate.avgConfidence());
            assertEquals(0.0, rate.minConfidence());
            assertEquals(0.0, rate.maxConfidence());
        }

        @Test
        @DisplayName("look-back window follows the time range")
        void windowFollowsRange() {
            when(repository.findByRecordedAtGreaterThanEqualOrderByRecordedAtDesc(NOW_UTC.minusDays(30)))
                .thenReturn(Flux.empty());

            StepVerifier.create(service.getIdentificationRate(TimeRange.LAST_MONTH))
                .assertNext(rate -> assertEquals("30d", rate.timeRange()))
                .verifyComplete();
        }
    }

    @Test
    @DisplayName("query statistics: processing times and per-service outcomes")
    void queryStatistics() {
        when(repository.findByRecordedAtGreaterThanEqualOrderByRecordedAtDesc(NOW_UTC.minusDays(7)))
            .thenReturn(mixedTraces());

        QueryStatisticsDTO stats = service.getQueryStatistics(TimeRange.LAST_WEEK).block();

        assertNotNull(stats);
        assertEquals(3, stats.totalQueries());
        assertEquals(1600.0 / 3, stats.avgProcessingTimeMs(), 1e-9);
        assertEquals(300, stats.minProcessingTimeMs());
        assertEquals(800, stats.maxProcessingTimeMs());

        ServiceStatisticsDTO verifier = stats.services().get(ServiceId.VERIFIER);
        assertEquals(3, verifier.calls());
        assertEquals(2, verifier.successes());
        assertEquals(0, verifier.missed());
        assertEquals(2.0 / 3, verifier.successRate(), 1e-9);
        assertEquals(100.0, verifier.avgLatencyMs(), 1e-9);
        assertEquals(Map.of("SUCCESS", 2L, "TRANSPORT_ERROR", 1L), verifier.statuses());

        ServiceStatisticsDTO chatbot = stats.services().get(ServiceId.CHATBOT);
        assertEquals(1, chatbot.successes());
        assertEquals(1, chatbot.missed());
        assertEquals(Map.of("SUCCESS", 1L, "TIMEOUT", 1L), chatbot.statuses());
        assertEquals(300.0, chatbot.avgLatencyMs(), 1e-9);
    }

    @Nested
    @DisplayName("trace lookup")
    class Lookup {

        @Test
        @DisplayName("latest trace re-parses the stored result set")
        void latest() {
            IdentificationTrace trace = Fixtures.trace("r9", NOW_UTC, "MATCH", 0.9, "SUCCESS", "SUCCESS", 400);
            trace.setResultSet("{\"VERIFIER\":{\"status\":\"SUCCESS\",\"latencyMs\":100}}");
            when(repository.findFirstByOrderByRecordedAtDesc()).thenReturn(Mono.just(trace));

            StepVerifier.create(service.getLatestTrace())
                .assertNext(dto -> {
                    assertEquals("r9", dto.requestId());
                    assertEquals("SUCCESS", dto.resultSet().get("VERIFIER").get("status").asText());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("no traces → empty")
        void noLatest() {
            when(repository.findFirstByOrderByRecordedAtDesc()).thenReturn(Mono.empty());

            StepVerifier.create(service.getLatestTrace()).verifyComplete();
        }

        @Test
        @DisplayName("lookup by request id returns every stored copy")
        void byRequestId() {
            when(repository.findByRequestIdOrderByRecordedAtDesc("r1")).thenReturn(Flux.just(
                Fixtures.trace("r1", NOW_UTC.minusMinutes(9), "MATCH", 0.9, "SUCCESS", "SUCCESS", 500),
                Fixtures.trace("r1", NOW_UTC.minusMinutes(10), "MATCH", 0.9, "SUCCESS", "SUCCESS", 500)));

            StepVerifier.create(service.getTraces("r1"))
                .expectNextCount(2)
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("TimeRange.fromLabel")
    class Labels {

        @Test
        @DisplayName("known labels, case and whitespace tolerant")
        void known() {
            assertEquals(TimeRange.LAST_HOUR, TimeRange.fromLabel(" 1H "));
            assertEquals(TimeRange.LAST_WEEK, TimeRange.fromLabel("7d"));
            assertEquals(TimeRange.LAST_MONTH, TimeRange.fromLabel("30d"));
        }

        @Test
        @DisplayName("unknown or missing label falls back to 24h")
        void fallback() {
            assertEquals(TimeRange.LAST_DAY, TimeRange.fromLabel("2y"));
            assertEquals(TimeRange.LAST_DAY, TimeRange.fromLabel(null));
        }
    }
}
