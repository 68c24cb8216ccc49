package com.example.spontaneous.lifecycle.service;

import com.example.spontaneous.lifecycle.dto.CreateBroadcastCommand;
import com.example.spontaneous.lifecycle.dto.UpdateBroadcastCommand;
import com.example.spontaneous.lifecycle.event.ActiveListingChangedEvent;
import com.example.spontaneous.shared.aspect.Monitored;
import com.example.spontaneous.shared.config.AppProperties;
import com.example.spontaneous.shared.config.MonitoringConfig;
import com.example.spontaneous.shared.dto.BroadcastResponse;
import com.example.spontaneous.shared.dto.JoinRequestedEvent;
import com.example.spontaneous.shared.exception.BroadcastExpiredException;
import com.example.spontaneous.shared.exception.ExpiresAtInPastException;
import com.example.spontaneous.shared.exception.ForbiddenOperationException;
import com.example.spontaneous.shared.exception.InvalidBroadcastInputException;
import com.example.spontaneous.shared.exception.JoinRequestAlreadyDecidedException;
import com.example.spontaneous.shared.exception.JoinRequestAlreadyExistsException;
import com.example.spontaneous.shared.exception.JoinRequestNotFoundException;
import com.example.spontaneous.shared.exception.ResourceNotFoundException;
import com.example.spontaneous.shared.exception.UnauthenticatedException;
import com.example.spontaneous.shared.mapper.BroadcastMapper;
import com.example.spontaneous.shared.model.Broadcast;
import com.example.spontaneous.shared.repository.BroadcastChanges;
import com.example.spontaneous.shared.repository.BroadcastRepository;
import com.example.spontaneous.shared.repository.JoinRequestRepository;
import com.example.spontaneous.shared.util.BroadcastIds;
import com.example.spontaneous.shared.util.Constants.BroadcastStatus;
import com.example.spontaneous.shared.util.Constants.JoinRequestStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Write side of the broadcast lifecycle. Every mutation is one statement scoped by id,
 * owner and open state, so concurrent writers and the expiry sweeper never overwrite
 * each other. Caller identity is always passed in explicitly.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Monitored("service")
public class BroadcastLifecycleService {

    private final BroadcastRepository broadcastRepository;
    private final JoinRequestRepository joinRequestRepository;
    private final BroadcastMapper broadcastMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final AppProperties appProperties;
    private final MonitoringConfig.BroadcastMetricsCollector metricsCollector;
    private final Clock clock;

    @Transactional
    public BroadcastResponse createBroadcast(String callerId, CreateBroadcastCommand command) {
        String creatorId = requireCaller(callerId);
        OffsetDateTime now = now();
        String title = requireText(command.getTitle(), "Title");
        String description = requireText(command.getDescription(), "Description");
        OffsetDateTime expiresAt = requireFuture(command.getExpiresAt(), now);

        Broadcast broadcast = Broadcast.builder()
                .title(title)
                .description(description)
                .creatorId(creatorId)
                .createdAt(now)
                .updatedAt(now)
                .expiresAt(expiresAt)
                .status(BroadcastStatus.ACTIVE)
                .build();
        broadcast = broadcastRepository.save(broadcast);

        eventPublisher.publishEvent(ActiveListingChangedEvent.of(broadcast.getId(), "created"));
        metricsCollector.incrementCounter(MonitoringConfig.BROADCASTS_CREATED);
        log.info("Broadcast {} created by {} expiring at {}", broadcast.getId(), creatorId, expiresAt);
        return broadcastMapper.toDetailedBroadcastResponse(broadcast, List.of(), now);
    }

    @Transactional
    public BroadcastResponse updateBroadcast(String callerId, String broadcastId, UpdateBroadcastCommand command) {
        String caller = requireCaller(callerId);
        Long id = BroadcastIds.parse(broadcastId);
        OffsetDateTime now = now();

        BroadcastChanges changes = BroadcastChanges.builder()
                .title(command.getTitle() == null ? null : requireText(command.getTitle(), "Title"))
                .description(command.getDescription() == null ? null : requireText(command.getDescription(), "Description"))
                .expiresAt(command.getExpiresAt() == null ? null : requireFuture(command.getExpiresAt(), now))
                .build();

        Broadcast existing = findBroadcast(id);
        requireCreator(existing, caller, "update");
        if (!existing.isOpenAt(now)) {
            throw new BroadcastExpiredException(id);
        }

        if (!changes.isEmpty()) {
            int updated = broadcastRepository.updateIfOpen(id, caller, changes, now);
            if (updated == 0) {
                // lost a race with deletion or the sweeper between the read and the update
                findBroadcast(id);
                throw new BroadcastExpiredException(id);
            }
            eventPublisher.publishEvent(ActiveListingChangedEvent.of(id, "updated"));
            log.info("Broadcast {} updated by {}", id, caller);
        }

        Broadcast current = findBroadcast(id);
        return broadcastMapper.toDetailedBroadcastResponse(current,
                joinRequestRepository.findByBroadcastIdOrderByRequestedAtAscIdAsc(id), now);
    }

    @Transactional
    public void deleteBroadcast(String callerId, String broadcastId) {
        String caller = requireCaller(callerId);
        Long id = BroadcastIds.parse(broadcastId);

        Broadcast existing = findBroadcast(id);
        requireCreator(existing, caller, "delete");

        int deleted = broadcastRepository.deleteOwnedBroadcast(id, caller);
        if (deleted == 0) {
            throw ResourceNotFoundException.broadcast(id);
        }
        eventPublisher.publishEvent(ActiveListingChangedEvent.of(id, "deleted"));
        log.info("Broadcast {} deleted by {}", id, caller);
    }

    @Transactional
    public void requestToJoin(String callerId, String broadcastId) {
        String requester = requireCaller(callerId);
        Long id = BroadcastIds.parse(broadcastId);
        OffsetDateTime now = now();

        Broadcast broadcast = findBroadcast(id);
        if (broadcast.isCreatedBy(requester)) {
            throw new InvalidBroadcastInputException("The creator cannot request to join their own broadcast");
        }
        if (!broadcast.isOpenAt(now)) {
            throw rejectedJoin(new BroadcastExpiredException(id));
        }
        if (joinRequestRepository.existsByBroadcastIdAndUserId(id, requester)) {
            throw rejectedJoin(new JoinRequestAlreadyExistsException(id, requester));
        }

        int inserted;
        try {
            inserted = joinRequestRepository.insertIfBroadcastOpen(id, requester, now);
        } catch (DuplicateKeyException e) {
            throw rejectedJoin(new JoinRequestAlreadyExistsException(id, requester, e));
        } catch (DataIntegrityViolationException e) {
            log.warn("Join request by {} on broadcast {} violated a constraint, treating the broadcast as gone: {}",
                    requester, id, e.getMessage());
            throw rejectedJoin(ResourceNotFoundException.broadcast(id));
        }
        if (inserted == 0) {
            // closed or deleted between the read and the insert
            if (broadcastRepository.findById(id).isEmpty()) {
                throw rejectedJoin(ResourceNotFoundException.broadcast(id));
            }
            throw rejectedJoin(new BroadcastExpiredException(id));
        }

        eventPublisher.publishEvent(new JoinRequestedEvent(BroadcastIds.format(id), requester));
        metricsCollector.incrementCounter(MonitoringConfig.JOIN_REQUESTS, "outcome", "accepted");
        log.info("User {} requested to join broadcast {}", requester, id);
    }

    @Transactional
    public void decideJoinRequest(String callerId, String broadcastId, String requesterId, JoinRequestStatus decision) {
        String caller = requireCaller(callerId);
        Long id = BroadcastIds.parse(broadcastId);
        if (decision == null || !decision.isDecision()) {
            throw new InvalidBroadcastInputException("Decision must be ACCEPTED or REJECTED");
        }
        if (requesterId == null || requesterId.isBlank()) {
            throw new InvalidBroadcastInputException("Requester id is required");
        }
        OffsetDateTime now = now();

        Broadcast broadcast = findBroadcast(id);
        requireCreator(broadcast, caller, "decide join requests on");

        boolean allowRedecision = appProperties.getJoinRequests().isAllowRedecision();
        int updated = allowRedecision
                ? joinRequestRepository.updateStatus(id, requesterId, decision.name(), now)
                : joinRequestRepository.updateStatusIfPending(id, requesterId, decision.name(), now);
        if (updated == 0) {
            if (!allowRedecision && joinRequestRepository.existsByBroadcastIdAndUserId(id, requesterId)) {
                throw new JoinRequestAlreadyDecidedException(id, requesterId);
            }
            throw new JoinRequestNotFoundException(id, requesterId);
        }

        metricsCollector.incrementCounter(MonitoringConfig.JOIN_DECISIONS, "decision", decision.name());
        log.info("Join request by {} on broadcast {} marked {} by {}", requesterId, id, decision, caller);
    }

    private <E extends RuntimeException> E rejectedJoin(E refusal) {
        metricsCollector.incrementCounter(MonitoringConfig.JOIN_REQUESTS, "outcome", "rejected");
        return refusal;
    }

    private Broadcast findBroadcast(Long id) {
        return broadcastRepository.findById(id)
                .orElseThrow(() -> ResourceNotFoundException.broadcast(id));
    }

    private void requireCreator(Broadcast broadcast, String caller, String action) {
        if (!broadcast.isCreatedBy(caller)) {
            log.warn("User {} attempted to {} broadcast {} owned by {}", caller, action, broadcast.getId(), broadcast.getCreatorId());
            throw new ForbiddenOperationException("Only the creator can " + action + " broadcast " + broadcast.getId());
        }
    }

    private static String requireCaller(String callerId) {
        if (callerId == null || callerId.isBlank()) {
            throw new UnauthenticatedException();
        }
        return callerId.trim();
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidBroadcastInputException(field + " must not be blank");
        }
        return value.trim();
    }

    private static OffsetDateTime requireFuture(OffsetDateTime expiresAt, OffsetDateTime now) {
        if (expiresAt == null) {
            throw new InvalidBroadcastInputException("Expiration time is required");
        }
        if (!expiresAt.isAfter(now)) {
            throw new ExpiresAtInPastException(expiresAt, now);
        }
        return expiresAt.withOffsetSameInstant(ZoneOffset.UTC);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
