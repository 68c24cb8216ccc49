package com.example.spontaneous.shared.service.cache;

import com.example.spontaneous.shared.config.AppProperties;
import com.example.spontaneous.shared.dto.BroadcastResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "broadcast.cache", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RedisCacheService implements CacheService {

    private final RedisTemplate<String, List<BroadcastResponse>> activeBroadcastsRedisTemplate;
    private final AppProperties appProperties;

    @Override
    public Optional<List<BroadcastResponse>> getActiveBroadcasts() {
        try {
            List<BroadcastResponse> cached = activeBroadcastsRedisTemplate.opsForValue().get(listingKey());
            if (cached == null) {
                log.debug("Active listing cache miss");
            }
            return Optional.ofNullable(cached);
        } catch (Exception e) {
            log.warn("Active listing cache read failed, falling back to the store: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void cacheActiveBroadcasts(List<BroadcastResponse> broadcasts) {
        try {
            activeBroadcastsRedisTemplate.opsForValue().set(listingKey(), broadcasts, appProperties.getCache().getActiveListingTtl());
            log.debug("Cached {} active broadcasts", broadcasts.size());
        } catch (Exception e) {
            log.warn("Failed to populate the active listing cache: {}", e.getMessage());
        }
    }

    @Override
    public void evictActiveBroadcasts() {
        try {
            activeBroadcastsRedisTemplate.delete(listingKey());
            log.debug("Evicted active listing cache");
        } catch (Exception e) {
            log.warn("Failed to evict the active listing cache, entries will expire with the TTL: {}", e.getMessage());
        }
    }

    private String listingKey() {
        return appProperties.getCache().getActiveListingKey();
    }
}
