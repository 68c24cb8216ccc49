package com.example.spontaneous.shared.util;

import com.example.spontaneous.shared.exception.InvalidBroadcastIdException;

/**
 * Broadcast ids are exposed as opaque strings and stored as BIGINT identities.
 */
public final class BroadcastIds {

    private BroadcastIds() {}

    public static Long parse(String broadcastId) {
        if (broadcastId == null || broadcastId.isBlank()) {
            throw new InvalidBroadcastIdException(broadcastId);
        }
        try {
            long id = Long.parseLong(broadcastId.trim());
            if (id <= 0) {
                throw new InvalidBroadcastIdException(broadcastId);
            }
            return id;
        } catch (NumberFormatException e) {
            throw new InvalidBroadcastIdException(broadcastId);
        }
    }

    public static String format(Long id) {
        return id == null ? null : String.valueOf(id);
    }
}
