package com.identityplatform.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Identification success over a time range. Counts are per distinct request id.
 */
public record IdentificationRateDTO(
    @JsonProperty("timeRange")          String timeRange,
    @JsonProperty("total")              long total,
    @JsonProperty("identified")         long identified,
    @JsonProperty("notIdentified")      long notIdentified,
    @JsonProperty("identificationRate") double identificationRate,
    @JsonProperty("avgConfidence")      double avgConfidence,
    @JsonProperty("minConfidence")      double minConfidence,
    @JsonProperty("maxConfidence")      double maxConfidence,
    @JsonProperty("outcomes")           Map<String, Long> outcomes
) {}
