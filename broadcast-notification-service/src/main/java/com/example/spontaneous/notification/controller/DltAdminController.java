package com.example.spontaneous.notification.controller;

import com.example.spontaneous.notification.dto.RedriveAllResult;
import com.example.spontaneous.notification.model.DeadLetterNotification;
import com.example.spontaneous.notification.service.DltService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;

@RestController
@RequestMapping("/api/admin/dlt")
@RequiredArgsConstructor
public class DltAdminController {

    private final DltService dltService;
    private final Scheduler jdbcScheduler;

    @GetMapping("/messages")
    public Mono<ResponseEntity<List<DeadLetterNotification>>> getDeadLetters() {
        return Mono.fromCallable(dltService::getDeadLetters)
                .map(ResponseEntity::ok)
                .subscribeOn(jdbcScheduler);
    }

    @PostMapping("/redrive/{id}")
    public Mono<ResponseEntity<Void>> redrive(@PathVariable String id) {
        return Mono.fromRunnable(() -> dltService.redrive(id))
                .subscribeOn(jdbcScheduler)
                .then(Mono.just(ResponseEntity.ok().<Void>build()));
    }

    @PostMapping("/redrive-all")
    public Mono<ResponseEntity<RedriveAllResult>> redriveAll() {
        return Mono.fromCallable(dltService::redriveAll)
                .map(ResponseEntity::ok)
                .subscribeOn(jdbcScheduler);
    }

    @DeleteMapping("/purge/{id}")
    public Mono<ResponseEntity<Void>> purge(@PathVariable String id) {
        return Mono.fromRunnable(() -> dltService.purge(id))
                .subscribeOn(jdbcScheduler)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @DeleteMapping("/purge-all")
    public Mono<ResponseEntity<Void>> purgeAll() {
        return Mono.fromCallable(dltService::purgeAll)
                .subscribeOn(jdbcScheduler)
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }
}
