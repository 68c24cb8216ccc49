package com.example.spontaneous.lifecycle.service;

import com.example.spontaneous.shared.config.AppProperties;
import com.example.spontaneous.shared.config.MonitoringConfig;
import com.example.spontaneous.shared.config.ShedLockConfig;
import com.example.spontaneous.shared.model.Broadcast;
import com.example.spontaneous.shared.repository.BroadcastRepository;
import com.example.spontaneous.shared.util.Constants.BroadcastStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.jdbc.DataJdbcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the scheduled jobs through the ShedLock proxy, the way the scheduler invokes them.
 */
@DataJdbcTest
@ActiveProfiles("test")
@Import({
        ShedLockConfig.class,
        BroadcastExpirationService.class,
        ExpiredBroadcastPurgeService.class
})
class ScheduledJobLockingTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 3, 10, 12, 0, 0, 0, ZoneOffset.UTC);

    @TestConfiguration
    static class LockingConfig {

        @Bean
        Clock clock() {
            return Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        }

        @Bean
        AppProperties appProperties() {
            return new AppProperties();
        }

        @Bean
        MonitoringConfig.BroadcastMetricsCollector broadcastMetricsCollector() {
            return new MonitoringConfig.BroadcastMetricsCollector(new SimpleMeterRegistry());
        }
    }

    @Autowired
    private BroadcastExpirationService expirationService;
    @Autowired
    private ExpiredBroadcastPurgeService purgeService;
    @Autowired
    private BroadcastRepository broadcastRepository;
    @Autowired
    private MonitoringConfig.BroadcastMetricsCollector metricsCollector;

    @Test
    void expireDueBroadcasts_flipsOverdueBroadcastUnderLock() {
        Broadcast overdue = saveBroadcast(NOW.minusMinutes(1), BroadcastStatus.ACTIVE);
        Broadcast open = saveBroadcast(NOW.plusHours(1), BroadcastStatus.ACTIVE);

        expirationService.expireDueBroadcasts();

        assertThat(broadcastRepository.findById(overdue.getId()).orElseThrow().getStatus()).isEqualTo(BroadcastStatus.EXPIRED);
        assertThat(broadcastRepository.findById(open.getId()).orElseThrow().getStatus()).isEqualTo(BroadcastStatus.ACTIVE);
        assertThat(metricsCollector.getCounterValue(MonitoringConfig.BROADCASTS_EXPIRED)).isEqualTo(1);
    }

    @Test
    void purgeExpiredBroadcasts_deletesRowsPastRetentionUnderLock() {
        Broadcast stale = saveBroadcast(NOW.minusDays(8), BroadcastStatus.EXPIRED);
        Broadcast recent = saveBroadcast(NOW.minusDays(1), BroadcastStatus.EXPIRED);

        purgeService.purgeExpiredBroadcasts();

        assertThat(broadcastRepository.findById(stale.getId())).isEmpty();
        assertThat(broadcastRepository.findById(recent.getId())).isPresent();
        assertThat(metricsCollector.getCounterValue(MonitoringConfig.BROADCASTS_PURGED)).isEqualTo(1);
    }

    private Broadcast saveBroadcast(OffsetDateTime expiresAt, BroadcastStatus status) {
        return broadcastRepository.save(Broadcast.builder()
                .title("Picnic")
                .description("Bring a blanket")
                .creatorId("alice")
                .createdAt(expiresAt.minusHours(2))
                .updatedAt(expiresAt.minusHours(2))
                .expiresAt(expiresAt)
                .status(status)
                .build());
    }
}
