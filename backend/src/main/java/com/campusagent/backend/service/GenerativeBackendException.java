package com.campusagent.backend.service;

import lombok.Getter;

/**
 * Failure of a call to the generative-language backend.
 */
@Getter
public class GenerativeBackendException extends RuntimeException {

    public enum Reason {
        UNAVAILABLE, // Unreachable, unconfigured, or non-success HTTP status
        MALFORMED_RESPONSE, // Body was not the expected candidate shape
        EMPTY_RESULT // No candidate text to use
    }

    private final Reason reason;

    public GenerativeBackendException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public GenerativeBackendException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
