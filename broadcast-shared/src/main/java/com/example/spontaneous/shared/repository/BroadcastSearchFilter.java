package com.example.spontaneous.shared.repository;

import com.example.spontaneous.shared.util.Constants.BroadcastStatus;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

@Value
@Builder
public class BroadcastSearchFilter {
    String keyword;
    BroadcastStatus status;
    OffsetDateTime createdFrom;
    OffsetDateTime createdTo;
    int offset;
    int limit;
}
