package com.example.spontaneous.lifecycle.controller;

import com.example.spontaneous.lifecycle.dto.AckResponse;
import com.example.spontaneous.lifecycle.dto.BroadcastSearchCriteria;
import com.example.spontaneous.lifecycle.dto.CreateBroadcastCommand;
import com.example.spontaneous.lifecycle.dto.JoinDecisionRequest;
import com.example.spontaneous.lifecycle.dto.UpdateBroadcastCommand;
import com.example.spontaneous.lifecycle.service.BroadcastLifecycleService;
import com.example.spontaneous.lifecycle.service.BroadcastQueryService;
import com.example.spontaneous.shared.dto.BroadcastPage;
import com.example.spontaneous.shared.dto.BroadcastResponse;
import com.example.spontaneous.shared.util.Constants;
import com.example.spontaneous.shared.util.Constants.BroadcastStatus;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * The caller identity arrives in {@code X-User-Id}, set by the gateway after it verified
 * the user. Store calls are blocking, so each handler runs them on the JDBC scheduler.
 */
@RestController
@RequestMapping("/api/broadcasts")
@RequiredArgsConstructor
@Slf4j
public class BroadcastController {

    private final BroadcastLifecycleService broadcastLifecycleService;
    private final BroadcastQueryService broadcastQueryService;
    private final Scheduler jdbcScheduler;

    @PostMapping
    @RateLimiter(name = "createBroadcastLimiter")
    public Mono<ResponseEntity<BroadcastResponse>> createBroadcast(
            @RequestHeader(name = Constants.USER_ID_HEADER, required = false) String userId,
            @Valid @RequestBody CreateBroadcastCommand command) {
        log.info("Received broadcast creation request from user: {}", userId);
        return Mono.fromCallable(() -> broadcastLifecycleService.createBroadcast(userId, command))
                .subscribeOn(jdbcScheduler)
                .map(response -> ResponseEntity.status(HttpStatus.CREATED).body(response));
    }

    @GetMapping("/active")
    public Mono<ResponseEntity<List<BroadcastResponse>>> getActiveBroadcasts() {
        return Mono.fromCallable(broadcastQueryService::getActiveBroadcasts)
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/search")
    public Mono<ResponseEntity<BroadcastPage>> searchBroadcasts(
            @RequestParam(required = false) String keyword,
            @RequestParam(required = false) BroadcastStatus status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime createdFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime createdTo,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize) {
        BroadcastSearchCriteria criteria = BroadcastSearchCriteria.builder()
                .keyword(keyword)
                .status(status)
                .createdFrom(createdFrom)
                .createdTo(createdTo)
                .page(page)
                .pageSize(pageSize)
                .build();
        return Mono.fromCallable(() -> broadcastQueryService.searchBroadcasts(criteria))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<BroadcastResponse>> getBroadcast(@PathVariable String id) {
        return Mono.fromCallable(() -> broadcastQueryService.getBroadcast(id))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @PatchMapping("/{id}")
    public Mono<ResponseEntity<BroadcastResponse>> updateBroadcast(
            @RequestHeader(name = Constants.USER_ID_HEADER, required = false) String userId,
            @PathVariable String id,
            @Valid @RequestBody UpdateBroadcastCommand command) {
        log.info("User {} updating broadcast {}", userId, id);
        return Mono.fromCallable(() -> broadcastLifecycleService.updateBroadcast(userId, id, command))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteBroadcast(
            @RequestHeader(name = Constants.USER_ID_HEADER, required = false) String userId,
            @PathVariable String id) {
        log.info("User {} deleting broadcast {}", userId, id);
        return Mono.fromRunnable(() -> broadcastLifecycleService.deleteBroadcast(userId, id))
                .subscribeOn(jdbcScheduler)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @PostMapping("/{id}/join")
    @RateLimiter(name = "joinBroadcastLimiter")
    public Mono<ResponseEntity<AckResponse>> requestToJoin(
            @RequestHeader(name = Constants.USER_ID_HEADER, required = false) String userId,
            @PathVariable String id) {
        log.info("User {} requesting to join broadcast {}", userId, id);
        return Mono.fromRunnable(() -> broadcastLifecycleService.requestToJoin(userId, id))
                .subscribeOn(jdbcScheduler)
                .then(Mono.just(ResponseEntity.ok(new AckResponse("Join request sent"))));
    }

    @PutMapping("/{id}/requests/{requesterId}")
    public Mono<ResponseEntity<AckResponse>> decideJoinRequest(
            @RequestHeader(name = Constants.USER_ID_HEADER, required = false) String userId,
            @PathVariable String id,
            @PathVariable String requesterId,
            @Valid @RequestBody JoinDecisionRequest request) {
        log.info("User {} deciding join request by {} on broadcast {}: {}", userId, requesterId, id, request.getStatus());
        return Mono.fromRunnable(() -> broadcastLifecycleService.decideJoinRequest(userId, id, requesterId, request.getStatus()))
                .subscribeOn(jdbcScheduler)
                .then(Mono.just(ResponseEntity.ok(new AckResponse("Join request " + request.getStatus().name().toLowerCase()))));
    }
}
