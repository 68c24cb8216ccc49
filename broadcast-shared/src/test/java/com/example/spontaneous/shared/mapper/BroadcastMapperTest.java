package com.example.spontaneous.shared.mapper;

import com.example.spontaneous.shared.dto.BroadcastResponse;
import com.example.spontaneous.shared.model.Broadcast;
import com.example.spontaneous.shared.model.JoinRequest;
import com.example.spontaneous.shared.util.Constants.BroadcastStatus;
import com.example.spontaneous.shared.util.Constants.JoinRequestStatus;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BroadcastMapperTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private final BroadcastMapper mapper = new BroadcastMapperImpl();

    @Test
    void toBroadcastResponse_reportsEffectiveStatusAndNoJoinRequests() {
        Broadcast stale = broadcast(NOW.minusSeconds(1));

        BroadcastResponse response = mapper.toBroadcastResponse(stale, NOW);

        assertThat(response.getId()).isEqualTo("5");
        assertThat(response.getCreatorId()).isEqualTo("alice");
        assertThat(response.getStatus()).isEqualTo(BroadcastStatus.EXPIRED);
        assertThat(response.getJoinRequests()).isNull();
    }

    @Test
    void toDetailedBroadcastResponse_includesJoinRequests() {
        JoinRequest accepted = JoinRequest.builder()
                .id(1L).broadcastId(5L).userId("bob").status(JoinRequestStatus.ACCEPTED)
                .requestedAt(NOW.minusMinutes(10)).decidedAt(NOW.minusMinutes(5)).build();

        BroadcastResponse response = mapper.toDetailedBroadcastResponse(broadcast(NOW.plusHours(1)), List.of(accepted), NOW);

        assertThat(response.getStatus()).isEqualTo(BroadcastStatus.ACTIVE);
        assertThat(response.getJoinRequests()).singleElement().satisfies(jr -> {
            assertThat(jr.getUserId()).isEqualTo("bob");
            assertThat(jr.getStatus()).isEqualTo(JoinRequestStatus.ACCEPTED);
            assertThat(jr.getDecidedAt()).isEqualTo(NOW.minusMinutes(5));
        });
    }

    private static Broadcast broadcast(OffsetDateTime expiresAt) {
        return Broadcast.builder()
                .id(5L)
                .title("Jam session")
                .description("Bring a guitar")
                .creatorId("alice")
                .createdAt(NOW.minusHours(1))
                .updatedAt(NOW.minusHours(1))
                .expiresAt(expiresAt)
                .status(BroadcastStatus.ACTIVE)
                .build();
    }
}
