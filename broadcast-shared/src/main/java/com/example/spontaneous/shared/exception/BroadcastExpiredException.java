package com.example.spontaneous.shared.exception;

public class BroadcastExpiredException extends BroadcastException {

    public BroadcastExpiredException(Long broadcastId) {
        super("Broadcast " + broadcastId + " has expired");
    }
}
