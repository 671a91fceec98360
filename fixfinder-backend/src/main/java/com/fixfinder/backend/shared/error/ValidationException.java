package com.fixfinder.backend.shared.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Raised when a request is malformed or asks for a transition the current state does not allow.
 */
public class ValidationException extends ResponseStatusException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
