package com.example.spontaneous.shared.repository;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Partial update of a broadcast; null fields are left untouched.
 */
@Value
@Builder
public class BroadcastChanges {
    String title;
    String description;
    OffsetDateTime expiresAt;

    public boolean isEmpty() {
        return title == null && description == null && expiresAt == null;
    }
}
