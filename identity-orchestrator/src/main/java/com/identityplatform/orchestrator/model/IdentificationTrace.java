package com.identityplatform.orchestrator.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted trace of one orchestration request. Written once, never updated.
 *
 * <p>{@code request_id} is not unique: a retried write may produce a second row for the
 * same request, and readers deduplicate on it.
 *
 * Column mapping (R2DBC snake_case convention):
 *   requestId          → request_id
 *   recordedAt         → recorded_at
 *   successfulServices → successful_services
 *   verifierStatus     → verifier_status
 *   processingTimeMs   → processing_time_ms
 *
 * resultSet: JSON per-service outcomes (status, latency, error detail; chatbot payload only on MATCH)
 */
@Data
@NoArgsConstructor
@Table("identification_trace")
public class IdentificationTrace {

    @Id
    private Long id;

    private String requestId;

    private LocalDateTime recordedAt;

    // ── request summary ──

    private String query;
    private String provider;
    private String imageFilename;
    private Integer imageSizeBytes;

    // ── decision ──

    private String outcome;
    private String reason;
    private Integer successfulServices;
    private Double confidence;
    private String personId;
    private String answer;

    // ── per-service outcomes ──

    /** {@code ServiceStatus} name, {@code null} when the verifier missed the overall deadline */
    private String verifierStatus;
    private Long verifierLatencyMs;

    /** {@code ServiceStatus} name, {@code null} when the chatbot missed the overall deadline */
    private String chatbotStatus;
    private Long chatbotLatencyMs;

    /** JSON map of {@code ServiceOutcomeDTO} by service */
    private String resultSet;

    // ── fusion config snapshot ──

    private Double threshold;
    private Double margin;
    private String fusionMethod;

    private Long processingTimeMs;
}
