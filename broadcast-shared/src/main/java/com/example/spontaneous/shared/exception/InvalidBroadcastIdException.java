package com.example.spontaneous.shared.exception;

public class InvalidBroadcastIdException extends InvalidBroadcastInputException {

    public InvalidBroadcastIdException(String broadcastId) {
        super("Invalid broadcast id: '" + broadcastId + "'");
    }
}
