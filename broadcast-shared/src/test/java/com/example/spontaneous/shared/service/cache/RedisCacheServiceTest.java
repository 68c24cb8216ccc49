package com.example.spontaneous.shared.service.cache;

import com.example.spontaneous.shared.config.AppProperties;
import com.example.spontaneous.shared.dto.BroadcastResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;

@ExtendWith(MockitoExtension.class)
class RedisCacheServiceTest {

    private static final String KEY = "broadcast:active-listing";

    @Mock
    private RedisTemplate<String, List<BroadcastResponse>> redisTemplate;

    @Mock
    private ValueOperations<String, List<BroadcastResponse>> valueOperations;

    private RedisCacheService cacheService;

    @BeforeEach
    void setUp() {
        cacheService = new RedisCacheService(redisTemplate, new AppProperties());
    }

    @Test
    void getActiveBroadcasts_returnsCachedListing() {
        List<BroadcastResponse> listing = List.of(BroadcastResponse.builder().id("1").title("Tennis").build());
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(KEY)).thenReturn(listing);

        assertThat(cacheService.getActiveBroadcasts()).contains(listing);
    }

    @Test
    void getActiveBroadcasts_missIsEmpty() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(KEY)).thenReturn(null);

        assertThat(cacheService.getActiveBroadcasts()).isEmpty();
    }

    @Test
    void getActiveBroadcasts_redisFailureIsTreatedAsMiss() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThat(cacheService.getActiveBroadcasts()).isEmpty();
    }

    @Test
    void cacheActiveBroadcasts_writesWithConfiguredTtl() {
        List<BroadcastResponse> listing = List.of();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        cacheService.cacheActiveBroadcasts(listing);

        verify(valueOperations).set(KEY, listing, Duration.ofSeconds(30));
    }

    @Test
    void cacheActiveBroadcasts_redisFailureIsSwallowed() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        doThrow(new RedisConnectionFailureException("timeout"))
                .when(valueOperations).set(anyString(), any(), any(Duration.class));

        assertThatCode(() -> cacheService.cacheActiveBroadcasts(List.of())).doesNotThrowAnyException();
    }

    @Test
    void evictActiveBroadcasts_deletesKeyAndToleratesFailure() {
        when(redisTemplate.delete(eq(KEY))).thenThrow(new RedisConnectionFailureException("down"));

        assertThatCode(() -> cacheService.evictActiveBroadcasts()).doesNotThrowAnyException();
        verify(redisTemplate).delete(KEY);
    }
}
