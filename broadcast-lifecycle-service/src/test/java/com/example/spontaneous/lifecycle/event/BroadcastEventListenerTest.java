package com.example.spontaneous.lifecycle.event;

import com.example.spontaneous.lifecycle.service.JoinRequestNotificationPublisher;
import com.example.spontaneous.shared.config.AppProperties;
import com.example.spontaneous.shared.dto.JoinRequestedEvent;
import com.example.spontaneous.shared.service.cache.CacheService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class BroadcastEventListenerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    private CacheService cacheService;
    @Mock
    private JoinRequestNotificationPublisher notificationPublisher;
    @Mock
    private TaskScheduler taskScheduler;

    private AppProperties appProperties;
    private BroadcastEventListener listener;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        listener = new BroadcastEventListener(cacheService, notificationPublisher, taskScheduler, appProperties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void activeListingChange_evictsNowAndAgainAfterDelay() {
        listener.handleActiveListingChanged(ActiveListingChangedEvent.of(3L, "updated"));

        verify(cacheService).evictActiveBroadcasts();
        ArgumentCaptor<Runnable> secondEviction = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(secondEviction.capture(), eq(NOW.plusSeconds(5)));

        // a stale listing written between the two evictions is dropped by the second one
        secondEviction.getValue().run();
        verify(cacheService, times(2)).evictActiveBroadcasts();
        verifyNoInteractions(notificationPublisher);
    }

    @Test
    void activeListingChange_zeroDelaySkipsSecondEviction() {
        appProperties.getCache().setSecondEvictionDelay(Duration.ZERO);

        listener.handleActiveListingChanged(ActiveListingChangedEvent.bulk("expired"));

        verify(cacheService).evictActiveBroadcasts();
        verifyNoInteractions(taskScheduler);
    }

    @Test
    void activeListingChange_cacheDisabledSkipsSecondEviction() {
        appProperties.getCache().setEnabled(false);

        listener.handleActiveListingChanged(ActiveListingChangedEvent.of(3L, "deleted"));

        verifyNoInteractions(taskScheduler);
    }

    @Test
    void joinRequested_isHandedToPublisher() {
        JoinRequestedEvent event = new JoinRequestedEvent("3", "bob");

        listener.handleJoinRequested(event);

        verify(notificationPublisher).publish(event);
        verifyNoInteractions(cacheService, taskScheduler);
    }
}
