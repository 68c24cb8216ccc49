package com.example.spontaneous.lifecycle.event;

import com.example.spontaneous.lifecycle.service.JoinRequestNotificationPublisher;
import com.example.spontaneous.shared.config.AppProperties;
import com.example.spontaneous.shared.dto.JoinRequestedEvent;
import com.example.spontaneous.shared.service.cache.CacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.Duration;

/**
 * Side effects that must only happen once the store change is durable. A rolled back
 * write neither evicts the listing nor notifies anyone.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BroadcastEventListener {

    private final CacheService cacheService;
    private final JoinRequestNotificationPublisher notificationPublisher;
    private final TaskScheduler taskScheduler;
    private final AppProperties appProperties;
    private final Clock clock;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleActiveListingChanged(ActiveListingChangedEvent event) {
        log.debug("Active listing changed ({}, broadcast {}). Evicting cached listing.", event.reason(), event.broadcastId());
        cacheService.evictActiveBroadcasts();

        // a listing miss that read the store before this commit may repopulate after the first eviction
        Duration delay = appProperties.getCache().getSecondEvictionDelay();
        if (appProperties.getCache().isEnabled() && !delay.isZero() && !delay.isNegative()) {
            taskScheduler.schedule(cacheService::evictActiveBroadcasts, clock.instant().plus(delay));
        }
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleJoinRequested(JoinRequestedEvent event) {
        log.info("Join request by {} on broadcast {} committed. Queuing creator notification.",
                event.getRequesterId(), event.getBroadcastId());
        notificationPublisher.publish(event);
    }
}
