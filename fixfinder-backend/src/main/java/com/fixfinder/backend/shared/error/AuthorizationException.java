package com.fixfinder.backend.shared.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class AuthorizationException extends ResponseStatusException {

    public AuthorizationException(String message) {
        super(HttpStatus.FORBIDDEN, message);
    }
}
