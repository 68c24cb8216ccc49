package com.example.spontaneous.notification.dto;

import lombok.Builder;
import lombok.Value;

/**
 * What the broadcast creator is told about a join request.
 */
@Value
@Builder
public class CreatorNotification {
    String recipientId;
    String broadcastId;
    String broadcastTitle;
    String requesterId;
}
