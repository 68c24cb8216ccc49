package com.example.spontaneous.shared.service.cache;

import com.example.spontaneous.shared.dto.BroadcastResponse;

import java.util.List;
import java.util.Optional;

/**
 * Read-through cache of the active listing. Implementations never throw: an unavailable
 * cache reads as a miss and writes or evictions become no-ops.
 */
public interface CacheService {

    Optional<List<BroadcastResponse>> getActiveBroadcasts();

    void cacheActiveBroadcasts(List<BroadcastResponse> broadcasts);

    void evictActiveBroadcasts();
}
