package com.example.spontaneous.shared.exception;

public class UnauthenticatedException extends BroadcastException {

    public UnauthenticatedException() {
        super("A caller identity is required for this operation");
    }
}
