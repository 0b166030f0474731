package com.identityplatform.common.exception;

import com.identityplatform.common.model.ServiceId;

/**
 * A service answered, but the answer does not match the contract the client expects.
 * Clients map it to {@link com.identityplatform.common.model.ServiceStatus#INVALID_RESPONSE}.
 */
public class InvalidServiceResponseException extends RuntimeException {

    private final ServiceId serviceId;

    public InvalidServiceResponseException(ServiceId serviceId, String message) {
        super("[" + serviceId + "] " + message);
        this.serviceId = serviceId;
    }

    public InvalidServiceResponseException(ServiceId serviceId, String message, Throwable cause) {
        super("[" + serviceId + "] " + message, cause);
        this.serviceId = serviceId;
    }

    public ServiceId getServiceId() {
        return serviceId;
    }
}
