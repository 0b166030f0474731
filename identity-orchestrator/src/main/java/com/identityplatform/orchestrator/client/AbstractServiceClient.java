package com.identityplatform.orchestrator.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.identityplatform.common.exception.InvalidServiceResponseException;
import com.identityplatform.common.model.IdentificationRequest;
import com.identityplatform.common.model.ServiceId;
import com.identityplatform.common.model.ServicePayload;
import com.identityplatform.common.model.ServiceResult;
import com.identityplatform.common.model.ServiceStatus;
import com.identityplatform.common.trace.RequestTraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Shared timing and failure classification for HTTP service clients.
 *
 * <p>Subclasses only perform the exchange and parse the body. Classification:
 * <ul>
 *   <li>{@link TimeoutException} or a Netty read timeout → {@link ServiceStatus#TIMEOUT}</li>
 *   <li>{@link InvalidServiceResponseException} → {@link ServiceStatus#INVALID_RESPONSE}</li>
 *   <li>non-2xx, connection and DNS failures → {@link ServiceStatus#TRANSPORT_ERROR}</li>
 * </ul>
 */
public abstract class AbstractServiceClient implements ServiceClient {

    private static final Logger log = LoggerFactory.getLogger(AbstractServiceClient.class);

    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    static final int MAX_DETAIL_LENGTH = 500;

    protected final ObjectMapper objectMapper;

    protected AbstractServiceClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Performs the outbound exchange and maps the body to a payload.
     * Shape violations must surface as {@link InvalidServiceResponseException}.
     */
    protected abstract Mono<ServicePayload> exchange(IdentificationRequest request, String requestId);

    @Override
    public final Mono<ServiceResult> call(IdentificationRequest request, Duration timeout) {
        return Mono.deferContextual(ctx -> {
            String requestId = RequestTraceContext.getRequestId(ctx);
            long start = System.nanoTime();
            return exchange(request, requestId)
                .switchIfEmpty(Mono.error(() -> invalid("empty response body")))
                .timeout(timeout)
                .map(payload -> ServiceResult.success(serviceId(), payload, elapsedSince(start)))
                .onErrorResume(e -> Mono.just(classify(e, elapsedSince(start), timeout)))
                .doOnNext(result -> logResult(result, requestId));
        });
    }

    private ServiceResult classify(Throwable e, Duration latency, Duration timeout) {
        if (e instanceof TimeoutException || hasNettyTimeoutCause(e)) {
            return ServiceResult.timeout(serviceId(), latency, "no response within " + timeout.toMillis() + "ms");
        }
        if (e instanceof InvalidServiceResponseException) {
            return ServiceResult.invalidResponse(serviceId(), latency, e.getMessage());
        }
        if (e instanceof WebClientResponseException wcre) {
            return ServiceResult.transportError(serviceId(), latency,
                "HTTP " + wcre.getStatusCode().value() + ": " + truncate(wcre.getResponseBodyAsString()));
        }
        if (e instanceof WebClientRequestException) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ServiceResult.transportError(serviceId(), latency,
                cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
        log.error("Unclassified failure calling service={}", serviceId(), e);
        return ServiceResult.transportError(serviceId(), latency,
            e.getClass().getSimpleName() + ": " + e.getMessage());
    }

    private static boolean hasNettyTimeoutCause(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof io.netty.handler.timeout.TimeoutException) return true;
            if (t.getCause() == t) break;
        }
        return false;
    }

    private void logResult(ServiceResult result, String requestId) {
        RequestTraceContext.withMdc(requestId, serviceId(), () -> {
            switch (result.status()) {
                case SUCCESS -> log.info("Service call complete. service={} status=SUCCESS latencyMs={} requestId={}",
                    serviceId(), result.latencyMs(), requestId);
                case INVALID_RESPONSE -> log.warn("Service response rejected. service={} latencyMs={} detail={} requestId={}",
                    serviceId(), result.latencyMs(), result.errorDetail(), requestId);
                default -> log.warn("Service call failed. service={} status={} latencyMs={} detail={} requestId={}",
                    serviceId(), result.status(), result.latencyMs(), result.errorDetail(), requestId);
            }
        });
    }

    // ── Response parsing helpers ──────────────────────────────────────────

    protected JsonNode readObject(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new InvalidServiceResponseException(serviceId(),
                "response is not valid JSON: " + truncate(body), e);
        }
        if (root == null || !root.isObject()) {
            throw invalid("expected a JSON object but got " + (root == null ? "nothing" : root.getNodeType()));
        }
        return root;
    }

    protected InvalidServiceResponseException invalid(String message) {
        return new InvalidServiceResponseException(serviceId(), message);
    }

    static String truncate(String text) {
        if (text == null) return "";
        return text.length() <= MAX_DETAIL_LENGTH ? text : text.substring(0, MAX_DETAIL_LENGTH) + "...";
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
