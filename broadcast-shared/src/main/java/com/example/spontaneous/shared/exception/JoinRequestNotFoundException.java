package com.example.spontaneous.shared.exception;

public class JoinRequestNotFoundException extends ResourceNotFoundException {

    public JoinRequestNotFoundException(Long broadcastId, String userId) {
        super("No join request from user " + userId + " on broadcast " + broadcastId);
    }
}
