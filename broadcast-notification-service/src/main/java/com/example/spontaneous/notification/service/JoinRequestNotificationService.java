package com.example.spontaneous.notification.service;

import com.example.spontaneous.notification.dto.CreatorNotification;
import com.example.spontaneous.notification.exception.NotificationDispatchException;
import com.example.spontaneous.shared.aspect.Monitored;
import com.example.spontaneous.shared.dto.JoinRequestedEvent;
import com.example.spontaneous.shared.model.Broadcast;
import com.example.spontaneous.shared.repository.BroadcastRepository;
import com.example.spontaneous.shared.repository.JoinRequestRepository;
import com.example.spontaneous.shared.util.BroadcastIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns a join-request event into a notification for the broadcast creator. The store is
 * re-read on every delivery, so a redelivered or late event reflects the current state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Monitored("notification")
public class JoinRequestNotificationService {

    private final BroadcastRepository broadcastRepository;
    private final JoinRequestRepository joinRequestRepository;
    private final NotificationDispatcher notificationDispatcher;

    public NotificationOutcome process(JoinRequestedEvent event) {
        Long broadcastId = BroadcastIds.parse(event.getBroadcastId());

        Optional<Broadcast> broadcast = broadcastRepository.findById(broadcastId);
        if (broadcast.isEmpty()) {
            log.warn("Broadcast {} no longer exists; dropping join notification for {}", broadcastId, event.getRequesterId());
            return NotificationOutcome.BROADCAST_GONE;
        }
        if (!joinRequestRepository.existsByBroadcastIdAndUserId(broadcastId, event.getRequesterId())) {
            log.warn("Join request of {} on broadcast {} no longer exists; dropping notification", event.getRequesterId(), broadcastId);
            return NotificationOutcome.REQUEST_GONE;
        }

        CreatorNotification notification = CreatorNotification.builder()
                .recipientId(broadcast.get().getCreatorId())
                .broadcastId(event.getBroadcastId())
                .broadcastTitle(broadcast.get().getTitle())
                .requesterId(event.getRequesterId())
                .build();
        try {
            notificationDispatcher.dispatch(notification);
        } catch (RuntimeException e) {
            throw new NotificationDispatchException("Failed to notify creator of broadcast " + broadcastId, e, event);
        }
        return NotificationOutcome.DISPATCHED;
    }
}
