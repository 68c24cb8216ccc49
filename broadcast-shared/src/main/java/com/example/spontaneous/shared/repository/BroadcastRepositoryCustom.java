package com.example.spontaneous.shared.repository;

import com.example.spontaneous.shared.model.Broadcast;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Statements whose shape depends on which fields or filters the caller supplied.
 */
public interface BroadcastRepositoryCustom {

    /**
     * Applies the non-null fields of {@code changes} only while the broadcast is owned by
     * {@code creatorId}, still ACTIVE and not past its deadline at {@code now}.
     *
     * @return the number of rows changed, 0 or 1
     */
    int updateIfOpen(Long id, String creatorId, BroadcastChanges changes, OffsetDateTime now);

    List<Broadcast> search(BroadcastSearchFilter filter, OffsetDateTime now);

    long countMatching(BroadcastSearchFilter filter, OffsetDateTime now);
}
