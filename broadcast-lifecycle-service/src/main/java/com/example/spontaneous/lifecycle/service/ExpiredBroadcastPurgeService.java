package com.example.spontaneous.lifecycle.service;

import com.example.spontaneous.shared.aspect.Monitored;
import com.example.spontaneous.shared.config.AppProperties;
import com.example.spontaneous.shared.config.MonitoringConfig;
import com.example.spontaneous.shared.repository.BroadcastRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Physically removes broadcasts that have been EXPIRED for longer than the retention
 * window. Their join requests go with them through the foreign key cascade.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpiredBroadcastPurgeService {

    private final BroadcastRepository broadcastRepository;
    private final AppProperties appProperties;
    private final MonitoringConfig.BroadcastMetricsCollector metricsCollector;
    private final Clock clock;

    @Monitored("scheduler")
    @Scheduled(cron = "${broadcast.expiry.purge-cron:0 0 * * * *}")
    @Transactional
    @SchedulerLock(name = "purgeExpiredBroadcasts", lockAtLeastFor = "PT1M", lockAtMostFor = "PT10M")
    public void purgeExpiredBroadcasts() {
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(appProperties.getExpiry().getRetention());
        log.info("Purging broadcasts expired before {}", cutoff);

        int purged = broadcastRepository.deleteExpiredBefore(cutoff);
        if (purged > 0) {
            metricsCollector.incrementCounter(MonitoringConfig.BROADCASTS_PURGED, purged);
            log.info("Purged {} expired broadcasts and their join requests.", purged);
        } else {
            log.debug("No expired broadcasts older than the retention window.");
        }
    }
}
