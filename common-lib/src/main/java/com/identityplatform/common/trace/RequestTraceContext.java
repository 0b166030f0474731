package com.identityplatform.common.trace;

import com.identityplatform.common.model.ServiceId;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Request id of one identification request, carried in the Reactor Context and bridged into
 * the MDC ({@value #REQUEST_ID_KEY}, and {@value #SERVICE_KEY} for client calls) only while a
 * log statement runs.
 */
public final class RequestTraceContext {

    public static final String REQUEST_ID_KEY = "requestId";
    public static final String SERVICE_KEY = "service";

    static final String MISSING_REQUEST_ID = "unknown";

    private RequestTraceContext() {}

    public static String newRequestId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Binds {@code requestId} to the whole orchestration pipeline. Apply to the assembled
     * pipeline, since {@code contextWrite} is visible only upstream.
     */
    public static <T> Mono<T> withRequestId(Mono<T> pipeline, String requestId) {
        return pipeline.contextWrite(ctx -> ctx.put(REQUEST_ID_KEY, requestId));
    }

    public static String getRequestId(ContextView ctx) {
        return ctx.getOrDefault(REQUEST_ID_KEY, MISSING_REQUEST_ID);
    }

    public static void withMdc(String requestId, Runnable logAction) {
        bridge(REQUEST_ID_KEY, requestId, logAction);
    }

    /**
     * Same as {@link #withMdc(String, Runnable)} with the called service added, so client logs
     * from concurrent calls of one request stay apart.
     */
    public static void withMdc(String requestId, ServiceId serviceId, Runnable logAction) {
        bridge(REQUEST_ID_KEY, requestId, () -> bridge(SERVICE_KEY, serviceId.name(), logAction));
    }

    // Restores an outer value so nested bridges on the same thread do not clear it.
    private static void bridge(String key, String value, Runnable action) {
        String previous = MDC.get(key);
        MDC.put(key, value);
        try {
            action.run();
        } finally {
            if (previous != null) {
                MDC.put(key, previous);
            } else {
                MDC.remove(key);
            }
        }
    }
}
