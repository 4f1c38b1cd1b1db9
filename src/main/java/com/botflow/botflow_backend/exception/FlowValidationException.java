package com.botflow.botflow_backend.exception;

/** Malformed editor or chat payload. Raised before anything is written. */
public class FlowValidationException extends RuntimeException {

    public FlowValidationException(String message) {
        super(message);
    }
}
