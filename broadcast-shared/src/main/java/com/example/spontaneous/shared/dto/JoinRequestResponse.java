package com.example.spontaneous.shared.dto;

import com.example.spontaneous.shared.util.Constants.JoinRequestStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JoinRequestResponse {
    private String userId;
    private JoinRequestStatus status;
    private OffsetDateTime requestedAt;
    private OffsetDateTime decidedAt;
}
