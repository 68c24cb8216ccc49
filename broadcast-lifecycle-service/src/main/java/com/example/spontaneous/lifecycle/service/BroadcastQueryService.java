package com.example.spontaneous.lifecycle.service;

import com.example.spontaneous.lifecycle.dto.BroadcastSearchCriteria;
import com.example.spontaneous.shared.aspect.Monitored;
import com.example.spontaneous.shared.config.AppProperties;
import com.example.spontaneous.shared.dto.BroadcastPage;
import com.example.spontaneous.shared.dto.BroadcastResponse;
import com.example.spontaneous.shared.exception.InvalidBroadcastInputException;
import com.example.spontaneous.shared.exception.ResourceNotFoundException;
import com.example.spontaneous.shared.mapper.BroadcastMapper;
import com.example.spontaneous.shared.model.Broadcast;
import com.example.spontaneous.shared.repository.BroadcastRepository;
import com.example.spontaneous.shared.repository.BroadcastSearchFilter;
import com.example.spontaneous.shared.repository.JoinRequestRepository;
import com.example.spontaneous.shared.service.cache.CacheService;
import com.example.spontaneous.shared.util.BroadcastIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
@Monitored("service")
public class BroadcastQueryService {

    private final BroadcastRepository broadcastRepository;
    private final JoinRequestRepository joinRequestRepository;
    private final BroadcastMapper broadcastMapper;
    private final CacheService cacheService;
    private final AppProperties appProperties;
    private final Clock clock;

    /**
     * Active listing, newest first. Served from the cache when present; entries whose
     * deadline passed since they were cached are dropped before returning.
     */
    @Transactional(readOnly = true)
    public List<BroadcastResponse> getActiveBroadcasts() {
        OffsetDateTime now = OffsetDateTime.now(clock);

        Optional<List<BroadcastResponse>> cached = cacheService.getActiveBroadcasts();
        if (cached.isPresent()) {
            log.debug("Cache HIT for active listing ({} entries)", cached.get().size());
            return cached.get().stream()
                    .filter(broadcast -> broadcast.getExpiresAt() != null && broadcast.getExpiresAt().isAfter(now))
                    .collect(Collectors.toList());
        }

        log.debug("Cache MISS for active listing. Fetching from database.");
        List<BroadcastResponse> active = broadcastRepository.findActiveBroadcasts(now).stream()
                .map(broadcast -> broadcastMapper.toBroadcastResponse(broadcast, now))
                .collect(Collectors.toList());
        cacheService.cacheActiveBroadcasts(active);
        return active;
    }

    @Transactional(readOnly = true)
    public BroadcastResponse getBroadcast(String broadcastId) {
        Long id = BroadcastIds.parse(broadcastId);
        Broadcast broadcast = broadcastRepository.findById(id)
                .orElseThrow(() -> ResourceNotFoundException.broadcast(id));
        return broadcastMapper.toDetailedBroadcastResponse(broadcast,
                joinRequestRepository.findByBroadcastIdOrderByRequestedAtAscIdAsc(id), OffsetDateTime.now(clock));
    }

    /**
     * Keyword, effective-status and creation-date search with 1-based offset pagination.
     * Never cached.
     */
    @Transactional(readOnly = true)
    public BroadcastPage searchBroadcasts(BroadcastSearchCriteria criteria) {
        int page = criteria.getPage() == null ? 1 : criteria.getPage();
        int pageSize = criteria.getPageSize() == null ? appProperties.getSearch().getDefaultPageSize() : criteria.getPageSize();
        int maxPageSize = appProperties.getSearch().getMaxPageSize();

        if (page < 1) {
            throw new InvalidBroadcastInputException("Page must be 1 or greater");
        }
        if (pageSize < 1 || pageSize > maxPageSize) {
            throw new InvalidBroadcastInputException("Page size must be between 1 and " + maxPageSize);
        }
        if (criteria.getCreatedFrom() != null && criteria.getCreatedTo() != null
                && criteria.getCreatedFrom().isAfter(criteria.getCreatedTo())) {
            throw new InvalidBroadcastInputException("createdFrom must not be after createdTo");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        BroadcastSearchFilter filter = BroadcastSearchFilter.builder()
                .keyword(criteria.getKeyword())
                .status(criteria.getStatus())
                .createdFrom(criteria.getCreatedFrom())
                .createdTo(criteria.getCreatedTo())
                .offset((page - 1) * pageSize)
                .limit(pageSize)
                .build();

        List<BroadcastResponse> items = broadcastRepository.search(filter, now).stream()
                .map(broadcast -> broadcastMapper.toBroadcastResponse(broadcast, now))
                .collect(Collectors.toList());
        long total = broadcastRepository.countMatching(filter, now);

        log.debug("Search '{}' (status={}) matched {} broadcasts, returning page {} of size {}",
                criteria.getKeyword(), criteria.getStatus(), total, page, pageSize);
        return BroadcastPage.builder()
                .items(items)
                .total(total)
                .page(page)
                .pageSize(pageSize)
                .build();
    }
}
