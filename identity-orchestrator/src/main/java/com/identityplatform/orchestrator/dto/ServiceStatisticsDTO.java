package com.identityplatform.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Per-service call outcomes. {@code missed} counts requests where the service had not
 * answered before the overall deadline.
 */
public record ServiceStatisticsDTO(
    @JsonProperty("calls")        long calls,
    @JsonProperty("successes")    long successes,
    @JsonProperty("missed")       long missed,
    @JsonProperty("successRate")  double successRate,
    @JsonProperty("avgLatencyMs") double avgLatencyMs,
    @JsonProperty("statuses")     Map<String, Long> statuses
) {}
