package com.identityplatform.common.model;

/**
 * Marker for the typed body of a successful {@link ServiceResult}.
 */
public interface ServicePayload {
}
