package com.identityplatform.orchestrator.dispatch;

import com.identityplatform.common.model.IdentificationRequest;
import com.identityplatform.common.model.ResultSet;
import com.identityplatform.common.model.ServiceId;
import com.identityplatform.common.model.ServiceResult;
import com.identityplatform.common.trace.RequestTraceContext;
import com.identityplatform.orchestrator.client.ServiceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Calls every configured {@link ServiceClient} concurrently and collects whatever answers
 * arrive before the overall deadline.
 *
 * <p>Services still pending at the deadline are cancelled and left out of the
 * {@link ResultSet}. A client that signals an error instead of a result is isolated and
 * recorded as a transport error, so one bad service never hides the other's result.
 * Cancelling the returned {@code Mono} cancels all in-flight calls and emits nothing.
 */
@Service
public class ServiceDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ServiceDispatcher.class);

    private final List<ServiceClient> clients;

    public ServiceDispatcher(List<ServiceClient> clients) {
        Set<ServiceId> seen = EnumSet.noneOf(ServiceId.class);
        for (ServiceClient client : clients) {
            if (!seen.add(client.serviceId())) {
                throw new IllegalStateException("More than one client configured for service " + client.serviceId());
            }
        }
        this.clients = List.copyOf(clients);
    }

    public Mono<ResultSet> dispatch(IdentificationRequest request, DispatchTimeouts timeouts) {
        return Mono.deferContextual(ctx -> {
            String requestId = RequestTraceContext.getRequestId(ctx);
            ResultSet.Builder builder = ResultSet.builder();
            log.info("Dispatching {} services in parallel. deadlineMs={} requestId={}",
                     clients.size(), timeouts.overallDeadline().toMillis(), requestId);

            return Flux.fromIterable(clients)
                .flatMap(client -> invoke(client, request, timeouts.forService(client.serviceId()), requestId))
                .take(timeouts.overallDeadline())
                .doOnNext(builder::offer)
                .then(Mono.fromSupplier(builder::build))
                .doOnNext(resultSet -> {
                    if (resultSet.size() < clients.size()) {
                        log.warn("Overall deadline reached with pending services. answered={} configured={} requestId={}",
                                 resultSet.size(), clients.size(), requestId);
                    }
                })
                .doOnCancel(() -> log.info("Dispatch cancelled, in-flight calls cancelled. requestId={}", requestId));
        });
    }

    private Mono<ServiceResult> invoke(ServiceClient client, IdentificationRequest request,
                                       Duration timeout, String requestId) {
        return Mono.defer(() -> client.call(request, timeout))
            .onErrorResume(e -> {
                RequestTraceContext.withMdc(requestId, client.serviceId(), () ->
                    log.error("Client signalled an error instead of a result. service={} requestId={}",
                              client.serviceId(), requestId, e));
                return Mono.just(ServiceResult.transportError(client.serviceId(), Duration.ZERO,
                    "unhandled client failure: " + e.getClass().getSimpleName() + ": " + e.getMessage()));
            });
    }
}
