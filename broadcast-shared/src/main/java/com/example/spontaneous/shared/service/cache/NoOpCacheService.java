package com.example.spontaneous.shared.service.cache;

import com.example.spontaneous.shared.dto.BroadcastResponse;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Wired when {@code broadcast.cache.enabled=false}; every listing read goes to the store.
 */
@Service
@ConditionalOnProperty(prefix = "broadcast.cache", name = "enabled", havingValue = "false")
public class NoOpCacheService implements CacheService {

    @Override
    public Optional<List<BroadcastResponse>> getActiveBroadcasts() {
        return Optional.empty();
    }

    @Override
    public void cacheActiveBroadcasts(List<BroadcastResponse> broadcasts) {
        // nothing to populate
    }

    @Override
    public void evictActiveBroadcasts() {
        // nothing to evict
    }
}
