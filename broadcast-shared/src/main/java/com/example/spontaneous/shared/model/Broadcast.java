package com.example.spontaneous.shared.model;

import com.example.spontaneous.shared.util.Constants.BroadcastStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.With;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

/**
 * A time-bounded invitation published by its creator. The stored status only
 * moves from ACTIVE to EXPIRED; callers should rely on {@link #effectiveStatus}
 * since the expiry sweeper may not have run yet for a row past its deadline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@With
@Table("broadcasts")
public class Broadcast {
    @Id
    private Long id;
    private String title;
    private String description;
    private String creatorId;
    private OffsetDateTime createdAt;
    private OffsetDateTime expiresAt;
    private OffsetDateTime updatedAt;
    private BroadcastStatus status;

    public BroadcastStatus effectiveStatus(OffsetDateTime now) {
        if (status == BroadcastStatus.EXPIRED || !expiresAt.isAfter(now)) {
            return BroadcastStatus.EXPIRED;
        }
        return BroadcastStatus.ACTIVE;
    }

    public boolean isOpenAt(OffsetDateTime now) {
        return effectiveStatus(now) == BroadcastStatus.ACTIVE;
    }

    public boolean isCreatedBy(String userId) {
        return creatorId != null && creatorId.equals(userId);
    }
}
