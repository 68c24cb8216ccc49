package com.example.spontaneous.shared.exception;

public class ForbiddenOperationException extends BroadcastException {

    public ForbiddenOperationException(String message) {
        super(message);
    }
}
