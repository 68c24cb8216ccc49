package com.example.spontaneous.notification.service;

public enum NotificationOutcome {
    DISPATCHED,
    /** The broadcast was deleted or purged before the event was processed. */
    BROADCAST_GONE,
    /** The join request no longer exists, usually because its broadcast was deleted. */
    REQUEST_GONE
}
