package com.example.spontaneous.lifecycle.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Partial update; omitted fields keep their current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateBroadcastCommand {

    @Size(max = 200, message = "Title must be at most 200 characters")
    private String title;

    @Size(max = 2000, message = "Description must be at most 2000 characters")
    private String description;

    private OffsetDateTime expiresAt;
}
