package com.example.spontaneous.shared.dto;

import com.example.spontaneous.shared.util.Constants.BroadcastStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Broadcast as seen by clients. {@code status} is the effective status at read time;
 * {@code joinRequests} is only filled in for single-broadcast reads and is omitted
 * from the active listing and search results.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BroadcastResponse {
    private String id;
    private String title;
    private String description;
    private String creatorId;
    private OffsetDateTime createdAt;
    private OffsetDateTime expiresAt;
    private OffsetDateTime updatedAt;
    private BroadcastStatus status;
    private List<JoinRequestResponse> joinRequests;
}
