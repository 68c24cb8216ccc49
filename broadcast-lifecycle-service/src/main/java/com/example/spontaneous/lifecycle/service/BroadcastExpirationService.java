package com.example.spontaneous.lifecycle.service;

import com.example.spontaneous.lifecycle.event.ActiveListingChangedEvent;
import com.example.spontaneous.shared.aspect.Monitored;
import com.example.spontaneous.shared.config.MonitoringConfig;
import com.example.spontaneous.shared.repository.BroadcastRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class BroadcastExpirationService {

    private final BroadcastRepository broadcastRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final MonitoringConfig.BroadcastMetricsCollector metricsCollector;
    private final Clock clock;

    /**
     * Flips every ACTIVE broadcast past its deadline to EXPIRED in one conditional update.
     * Join requests are left as they are. The SchedulerLock keeps the sweep to one node at a time.
     */
    @Monitored("scheduler")
    @Scheduled(fixedRateString = "${broadcast.expiry.sweep-interval:60000}")
    @Transactional
    @SchedulerLock(name = "expireDueBroadcasts", lockAtLeastFor = "PT5S", lockAtMostFor = "PT55S")
    public void expireDueBroadcasts() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        log.debug("Checking for broadcasts due to expire at {}", now);

        int expired = broadcastRepository.expireDueBroadcasts(now);
        if (expired == 0) {
            log.trace("No broadcasts to expire at this time.");
            return;
        }

        eventPublisher.publishEvent(ActiveListingChangedEvent.bulk("expired"));
        metricsCollector.incrementCounter(MonitoringConfig.BROADCASTS_EXPIRED, expired);
        log.info("Expired {} broadcasts.", expired);
    }
}
