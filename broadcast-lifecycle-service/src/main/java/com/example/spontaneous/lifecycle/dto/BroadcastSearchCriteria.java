package com.example.spontaneous.lifecycle.dto;

import com.example.spontaneous.shared.util.Constants.BroadcastStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Every field is optional. {@code page} is 1-based.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastSearchCriteria {
    private String keyword;
    private BroadcastStatus status;
    private OffsetDateTime createdFrom;
    private OffsetDateTime createdTo;
    private Integer page;
    private Integer pageSize;
}
