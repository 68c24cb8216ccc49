package com.example.spontaneous.shared.repository;

import com.example.spontaneous.shared.model.JoinRequest;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface JoinRequestRepository extends CrudRepository<JoinRequest, Long> {

    List<JoinRequest> findByBroadcastIdOrderByRequestedAtAscIdAsc(Long broadcastId);

    Optional<JoinRequest> findByBroadcastIdAndUserId(Long broadcastId, String userId);

    boolean existsByBroadcastIdAndUserId(Long broadcastId, String userId);

    /**
     * Inserts a PENDING request only while the parent broadcast is ACTIVE and before its
     * deadline. A concurrent duplicate fails on the (broadcast_id, user_id) unique constraint.
     *
     * @return 1 if inserted, 0 if the broadcast is missing or closed
     */
    @Modifying
    @Query("INSERT INTO join_requests (broadcast_id, user_id, status, requested_at) "
            + "SELECT id, CAST(:userId AS VARCHAR(255)), 'PENDING', CAST(:now AS TIMESTAMP WITH TIME ZONE) FROM broadcasts "
            + "WHERE id = :broadcastId AND status = 'ACTIVE' AND expires_at > :now")
    int insertIfBroadcastOpen(@Param("broadcastId") Long broadcastId, @Param("userId") String userId,
                              @Param("now") OffsetDateTime now);

    @Modifying
    @Query("UPDATE join_requests SET status = :status, decided_at = :now WHERE broadcast_id = :broadcastId AND user_id = :userId")
    int updateStatus(@Param("broadcastId") Long broadcastId, @Param("userId") String userId,
                     @Param("status") String status, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("UPDATE join_requests SET status = :status, decided_at = :now "
            + "WHERE broadcast_id = :broadcastId AND user_id = :userId AND status = 'PENDING'")
    int updateStatusIfPending(@Param("broadcastId") Long broadcastId, @Param("userId") String userId,
                              @Param("status") String status, @Param("now") OffsetDateTime now);
}
