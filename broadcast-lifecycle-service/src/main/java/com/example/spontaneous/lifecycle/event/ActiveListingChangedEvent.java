package com.example.spontaneous.lifecycle.event;

/**
 * Published inside a write transaction whenever the membership or content of the active
 * listing changed. {@code broadcastId} is null for bulk changes such as an expiry sweep.
 */
public record ActiveListingChangedEvent(Long broadcastId, String reason) {

    public static ActiveListingChangedEvent of(Long broadcastId, String reason) {
        return new ActiveListingChangedEvent(broadcastId, reason);
    }

    public static ActiveListingChangedEvent bulk(String reason) {
        return new ActiveListingChangedEvent(null, reason);
    }
}
