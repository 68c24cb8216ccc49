package com.example.spontaneous.shared.model;

import com.example.spontaneous.shared.util.Constants.JoinRequestStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

/**
 * One user's request to join a broadcast. Unique per (broadcast, user) and removed
 * together with its broadcast.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("join_requests")
public class JoinRequest {
    @Id
    private Long id;
    private Long broadcastId;
    private String userId;
    private JoinRequestStatus status;
    private OffsetDateTime requestedAt;
    private OffsetDateTime decidedAt;
}
