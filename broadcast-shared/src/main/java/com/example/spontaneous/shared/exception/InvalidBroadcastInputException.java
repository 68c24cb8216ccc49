package com.example.spontaneous.shared.exception;

public class InvalidBroadcastInputException extends BroadcastException {

    public InvalidBroadcastInputException(String message) {
        super(message);
    }
}
