package com.identityplatform.orchestrator.logger;

import com.identityplatform.common.model.Decision;
import com.identityplatform.common.model.FusionConfig;
import com.identityplatform.common.model.ResultSet;
import com.identityplatform.common.trace.RequestTraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of an identification request as it moves through the orchestration pipeline.
 * Side effects only; nothing here influences the decision.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}      : input validated, dispatch about to start</li>
 *   <li>{@link #RESULT_SET_ASSEMBLED}  : dispatcher returned (all answered or deadline reached)</li>
 *   <li>{@link #DECISION_FUSED}        : fusion policy produced the decision</li>
 *   <li>{@link #TRACE_DISPATCHED}      : trace handed to the recorder, response about to be returned</li>
 * </ol>
 * {@link #REQUEST_CANCELLED} replaces the tail when the caller goes away first.
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String REQUEST_RECEIVED     = "REQUEST_RECEIVED";
    public static final String RESULT_SET_ASSEMBLED = "RESULT_SET_ASSEMBLED";
    public static final String DECISION_FUSED       = "DECISION_FUSED";
    public static final String TRACE_DISPATCHED     = "TRACE_DISPATCHED";
    public static final String REQUEST_CANCELLED    = "REQUEST_CANCELLED";

    /**
     * {@code doOnEach} consumer that logs {@code stageName} on {@code onNext}, reading the
     * request id from the Reactor Context carried by the signal.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String requestId = RequestTraceContext.getRequestId(signal.getContextView());
            RequestTraceContext.withMdc(requestId, () ->
                log.info("[DecisionFlow] stage={} requestId={}", stageName, requestId)
            );
        };
    }

    public void logWithRequestId(String stageName, String requestId) {
        RequestTraceContext.withMdc(requestId, () ->
            log.info("[DecisionFlow] stage={} requestId={}", stageName, requestId)
        );
    }

    public void logResultSet(ResultSet resultSet, String requestId) {
        RequestTraceContext.withMdc(requestId, () ->
            log.info("[DecisionFlow] stage={} answered={} successful={} services={} requestId={}",
                     RESULT_SET_ASSEMBLED, resultSet.size(), resultSet.successfulServices(),
                     resultSet.asMap().keySet(), requestId)
        );
    }

    public void logDecision(Decision decision, FusionConfig config, String requestId) {
        RequestTraceContext.withMdc(requestId, () ->
            log.info("[DecisionFlow] stage={} outcome={} reason={} confidence={} successfulServices={} "
                     + "method={} threshold={} margin={} requestId={}",
                     DECISION_FUSED, decision.outcome(), decision.reason().code(), decision.confidence(),
                     decision.successfulServices(), config.method(), config.threshold(), config.margin(),
                     requestId)
        );
    }
}
