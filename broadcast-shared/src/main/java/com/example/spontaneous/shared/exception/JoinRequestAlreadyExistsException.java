package com.example.spontaneous.shared.exception;

public class JoinRequestAlreadyExistsException extends BroadcastException {

    public JoinRequestAlreadyExistsException(Long broadcastId, String userId) {
        super("User " + userId + " has already requested to join broadcast " + broadcastId);
    }

    public JoinRequestAlreadyExistsException(Long broadcastId, String userId, Throwable cause) {
        super("User " + userId + " has already requested to join broadcast " + broadcastId, cause);
    }
}
