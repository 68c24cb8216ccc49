package com.example.spontaneous.shared.exception;

public class JoinRequestAlreadyDecidedException extends BroadcastException {

    public JoinRequestAlreadyDecidedException(Long broadcastId, String userId) {
        super("The join request from user " + userId + " on broadcast " + broadcastId + " has already been decided");
    }
}
