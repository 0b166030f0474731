package com.identityplatform.common.model;

/**
 * Outcome class of a single outbound service call.
 *
 * <p>{@link #INVALID_RESPONSE} means a response arrived but did not match the expected
 * contract. It is kept apart from {@link #TRANSPORT_ERROR} because it points at an
 * integration bug rather than a network problem.
 */
public enum ServiceStatus {
    SUCCESS,
    TIMEOUT,
    TRANSPORT_ERROR,
    INVALID_RESPONSE
}
