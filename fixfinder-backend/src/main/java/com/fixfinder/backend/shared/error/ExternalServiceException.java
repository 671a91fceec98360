package com.fixfinder.backend.shared.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Failure of a collaborator outside the primary store write: realtime transport, push delivery.
 * Callers on the secondary path log it and continue.
 */
public class ExternalServiceException extends ResponseStatusException {

    public ExternalServiceException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, message, cause);
    }
}
