package com.example.spontaneous.shared.exception;

public class ResourceNotFoundException extends BroadcastException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException broadcast(Long broadcastId) {
        return new ResourceNotFoundException("Broadcast not found with id: " + broadcastId);
    }
}
