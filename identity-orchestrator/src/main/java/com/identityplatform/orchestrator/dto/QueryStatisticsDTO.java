package com.identityplatform.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.identityplatform.common.model.ServiceId;

import java.util.Map;

public record QueryStatisticsDTO(
    @JsonProperty("timeRange")           String timeRange,
    @JsonProperty("totalQueries")        long totalQueries,
    @JsonProperty("avgProcessingTimeMs") double avgProcessingTimeMs,
    @JsonProperty("minProcessingTimeMs") long minProcessingTimeMs,
    @JsonProperty("maxProcessingTimeMs") long maxProcessingTimeMs,
    @JsonProperty("services")            Map<ServiceId, ServiceStatisticsDTO> services
) {}
