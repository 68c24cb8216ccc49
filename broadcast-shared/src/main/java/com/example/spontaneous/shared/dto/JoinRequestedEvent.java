package com.example.spontaneous.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Queue message telling the notification worker that {@code requesterId} asked to join
 * {@code broadcastId}. Published after the join request commits; may be delivered more than once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JoinRequestedEvent {
    private String broadcastId;
    private String requesterId;
}
