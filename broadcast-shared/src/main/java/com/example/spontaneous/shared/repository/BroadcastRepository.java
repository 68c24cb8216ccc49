package com.example.spontaneous.shared.repository;

import com.example.spontaneous.shared.model.Broadcast;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface BroadcastRepository extends CrudRepository<Broadcast, Long>, BroadcastRepositoryCustom {

    @Query("SELECT * FROM broadcasts WHERE status = 'ACTIVE' AND expires_at > :now ORDER BY created_at DESC, id DESC")
    List<Broadcast> findActiveBroadcasts(@Param("now") OffsetDateTime now);

    /**
     * Flips every due broadcast in one statement. Re-running it is a no-op for rows
     * that are already EXPIRED.
     */
    @Modifying
    @Query("UPDATE broadcasts SET status = 'EXPIRED', updated_at = :now WHERE status = 'ACTIVE' AND expires_at <= :now")
    int expireDueBroadcasts(@Param("now") OffsetDateTime now);

    @Modifying
    @Query("DELETE FROM broadcasts WHERE id = :id AND creator_id = :creatorId")
    int deleteOwnedBroadcast(@Param("id") Long id, @Param("creatorId") String creatorId);

    @Modifying
    @Query("DELETE FROM broadcasts WHERE status = 'EXPIRED' AND expires_at < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") OffsetDateTime cutoff);
}
