package com.example.spontaneous.lifecycle.service;

import com.example.spontaneous.lifecycle.dto.CreateBroadcastCommand;
import com.example.spontaneous.lifecycle.dto.UpdateBroadcastCommand;
import com.example.spontaneous.lifecycle.event.ActiveListingChangedEvent;
import com.example.spontaneous.lifecycle.support.MutableClock;
import com.example.spontaneous.shared.config.AppProperties;
import com.example.spontaneous.shared.config.MonitoringConfig;
import com.example.spontaneous.shared.dto.BroadcastResponse;
import com.example.spontaneous.shared.dto.JoinRequestedEvent;
import com.example.spontaneous.shared.exception.BroadcastExpiredException;
import com.example.spontaneous.shared.exception.ExpiresAtInPastException;
import com.example.spontaneous.shared.exception.ForbiddenOperationException;
import com.example.spontaneous.shared.exception.JoinRequestAlreadyExistsException;
import com.example.spontaneous.shared.mapper.BroadcastMapperImpl;
import com.example.spontaneous.shared.repository.JoinRequestRepository;
import com.example.spontaneous.shared.service.cache.NoOpCacheService;
import com.example.spontaneous.shared.util.Constants.BroadcastStatus;
import com.example.spontaneous.shared.util.Constants.JoinRequestStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.jdbc.DataJdbcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end engine behaviour against the in-memory store, with time driven by a test clock.
 */
@DataJdbcTest
@ActiveProfiles("test")
@RecordApplicationEvents
@Import({
        BroadcastLifecycleService.class,
        BroadcastQueryService.class,
        BroadcastExpirationService.class,
        BroadcastMapperImpl.class,
        NoOpCacheService.class
})
class BroadcastLifecycleScenarioTest {

    private static final Instant START = Instant.parse("2025-03-01T12:00:00Z");

    @TestConfiguration
    static class ScenarioConfig {

        @Bean
        MutableClock clock() {
            return new MutableClock(START);
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
    private BroadcastLifecycleService lifecycleService;
    @Autowired
    private BroadcastQueryService queryService;
    @Autowired
    private BroadcastExpirationService expirationService;
    @Autowired
    private JoinRequestRepository joinRequestRepository;
    @Autowired
    private MutableClock clock;
    @Autowired
    private ApplicationEvents events;

    @BeforeEach
    void resetClock() {
        clock.setInstant(START);
    }

    @Test
    void joinThenDuplicateThenAccept() {
        BroadcastResponse created = lifecycleService.createBroadcast("alice",
                command("Board games", "Catan at my place", now().plusHours(1)));

        lifecycleService.requestToJoin("bob", created.getId());
        assertThatThrownBy(() -> lifecycleService.requestToJoin("bob", created.getId()))
                .isInstanceOf(JoinRequestAlreadyExistsException.class);
        lifecycleService.decideJoinRequest("alice", created.getId(), "bob", JoinRequestStatus.ACCEPTED);

        BroadcastResponse reloaded = queryService.getBroadcast(created.getId());
        assertThat(reloaded.getJoinRequests()).singleElement().satisfies(request -> {
            assertThat(request.getUserId()).isEqualTo("bob");
            assertThat(request.getStatus()).isEqualTo(JoinRequestStatus.ACCEPTED);
            assertThat(request.getDecidedAt()).isNotNull();
        });
        assertThat(events.stream(JoinRequestedEvent.class))
                .containsExactly(new JoinRequestedEvent(created.getId(), "bob"));
    }

    @Test
    void sweepAfterDeadlineExpiresBroadcastAndBlocksJoins() {
        BroadcastResponse created = lifecycleService.createBroadcast("alice",
                command("Coffee", "Quick one downstairs", now().plusSeconds(1)));

        clock.advance(Duration.ofSeconds(2));
        assertThatThrownBy(() -> lifecycleService.requestToJoin("bob", created.getId()))
                .isInstanceOf(BroadcastExpiredException.class);

        expirationService.expireDueBroadcasts();
        expirationService.expireDueBroadcasts();

        assertThat(queryService.getBroadcast(created.getId()).getStatus()).isEqualTo(BroadcastStatus.EXPIRED);
        assertThat(queryService.getActiveBroadcasts()).isEmpty();
        assertThatThrownBy(() -> lifecycleService.requestToJoin("bob", created.getId()))
                .isInstanceOf(BroadcastExpiredException.class);
        assertThat(events.stream(ActiveListingChangedEvent.class)
                .filter(ActiveListingChangedEvent.bulk("expired")::equals))
                .hasSize(1);
    }

    @Test
    void updateRulesForOwnerAndDeadline() {
        BroadcastResponse created = lifecycleService.createBroadcast("alice",
                command("Tennis", "Doubles at the club", now().plusHours(1)));

        assertThatThrownBy(() -> lifecycleService.updateBroadcast("bob", created.getId(),
                UpdateBroadcastCommand.builder().title("Hijacked").build()))
                .isInstanceOf(ForbiddenOperationException.class);
        assertThatThrownBy(() -> lifecycleService.updateBroadcast("alice", created.getId(),
                UpdateBroadcastCommand.builder().expiresAt(now().minusMinutes(1)).build()))
                .isInstanceOf(ExpiresAtInPastException.class);

        OffsetDateTime extended = now().plusHours(3);
        lifecycleService.updateBroadcast("alice", created.getId(), UpdateBroadcastCommand.builder().expiresAt(extended).build());

        BroadcastResponse reloaded = queryService.getBroadcast(created.getId());
        assertThat(reloaded.getExpiresAt().toInstant()).isEqualTo(extended.toInstant());
        assertThat(reloaded.getTitle()).isEqualTo("Tennis");
    }

    @Test
    void activeListingNeverShowsBroadcastsPastDeadline() {
        BroadcastResponse shortLived = lifecycleService.createBroadcast("alice",
                command("Short", "Leaving soon", now().plusSeconds(30)));
        BroadcastResponse longLived = lifecycleService.createBroadcast("carol",
                command("Long", "All afternoon", now().plusHours(4)));

        assertThat(queryService.getActiveBroadcasts()).extracting(BroadcastResponse::getId)
                .containsExactlyInAnyOrder(shortLived.getId(), longLived.getId());

        clock.advance(Duration.ofSeconds(30));

        assertThat(queryService.getActiveBroadcasts()).extracting(BroadcastResponse::getId)
                .containsExactly(longLived.getId());
    }

    @Test
    void deleteRemovesJoinRequestsWithBroadcast() {
        BroadcastResponse created = lifecycleService.createBroadcast("alice",
                command("Cinema", "Late showing", now().plusHours(2)));
        lifecycleService.requestToJoin("bob", created.getId());

        lifecycleService.deleteBroadcast("alice", created.getId());

        assertThat(joinRequestRepository.existsByBroadcastIdAndUserId(Long.valueOf(created.getId()), "bob")).isFalse();
        assertThat(queryService.getActiveBroadcasts()).isEmpty();
        assertThat(events.stream(ActiveListingChangedEvent.class))
                .extracting(ActiveListingChangedEvent::reason)
                .containsExactly("created", "deleted");
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private static CreateBroadcastCommand command(String title, String description, OffsetDateTime expiresAt) {
        return CreateBroadcastCommand.builder().title(title).description(description).expiresAt(expiresAt).build();
    }
}
