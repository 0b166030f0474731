package com.identityplatform.orchestrator.client;

import com.identityplatform.common.model.IdentificationRequest;
import com.identityplatform.common.model.ServiceId;
import com.identityplatform.common.model.ServiceResult;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * One timed call to an external identification service.
 *
 * <p>Implementations enforce {@code timeout} themselves and always complete with a
 * {@link ServiceResult}; failures are values, not error signals. No state is kept
 * between calls.
 */
public interface ServiceClient {

    ServiceId serviceId();

    Mono<ServiceResult> call(IdentificationRequest request, Duration timeout);
}
