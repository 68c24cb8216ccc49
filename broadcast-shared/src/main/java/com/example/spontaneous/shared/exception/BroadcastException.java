package com.example.spontaneous.shared.exception;

/**
 * Root of the domain failures raised by the lifecycle engine. Each subtype maps
 * to one HTTP status in {@link GlobalExceptionHandler}.
 */
public abstract class BroadcastException extends RuntimeException {

    protected BroadcastException(String message) {
        super(message);
    }

    protected BroadcastException(String message, Throwable cause) {
        super(message, cause);
    }
}
