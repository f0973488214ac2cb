/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.web;

import com.uistudio.lock.coordinator.LockCoordinator;
import com.uistudio.lock.model.LockError;
import com.uistudio.lock.model.LockRecord;
import com.uistudio.lock.model.LockStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP access to this process's lock coordinator.
 */
@Slf4j
@RestController
@RequestMapping("/api/locks")
@RequiredArgsConstructor
public class LockController {

    private final LockCoordinator coordinator;

    @GetMapping
    public ResponseEntity<HeldLocksResponse> held() {
        return ResponseEntity.ok(new HeldLocksResponse(
                coordinator.getSelfId(), new TreeSet<>(coordinator.heldResources())));
    }

    @GetMapping("/{resourceId}")
    public CompletableFuture<ResponseEntity<StatusResponse>> status(@PathVariable String resourceId) {
        return coordinator.status(resourceId)
                .thenApply(status -> ResponseEntity.ok(StatusResponse.from(resourceId, status)));
    }

    @PostMapping("/{resourceId}")
    public CompletableFuture<ResponseEntity<AcquireResponse>> acquire(@PathVariable String resourceId) {
        log.debug("Acquire request for {}", resourceId);
        return coordinator.tryAcquire(resourceId)
                .thenApply(result -> result.fold(
                        record -> ResponseEntity.ok(AcquireResponse.acquired(record)),
                        error -> ResponseEntity.status(statusFor(error))
                                .body(AcquireResponse.refused(resourceId, error))
                ));
    }

    @DeleteMapping("/{resourceId}")
    public CompletableFuture<ResponseEntity<Void>> release(@PathVariable String resourceId) {
        log.debug("Release request for {}", resourceId);
        return coordinator.release(resourceId)
                .thenApply(ignored -> ResponseEntity.noContent().build());
    }

    @PostMapping("/renewals")
    public CompletableFuture<ResponseEntity<RenewalResponse>> renew() {
        return coordinator.renewHeld()
                .thenApply(renewed -> ResponseEntity.status(HttpStatus.ACCEPTED).body(new RenewalResponse(renewed)));
    }

    private static HttpStatus statusFor(LockError error) {
        return switch (error.code()) {
            case ALREADY_LOCKED -> HttpStatus.CONFLICT;
            case LEDGER_UNAVAILABLE, CLOSED -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    public record HeldLocksResponse(String contextId, Set<String> resourceIds) {}

    public record RenewalResponse(int renewed) {}

    public record StatusResponse(
            String resourceId,
            boolean locked,
            boolean ownedBySelf,
            String holderId,
            Long leaseAgeMs
    ) {
        static StatusResponse from(String resourceId, LockStatus status) {
            return new StatusResponse(
                    resourceId,
                    status.locked(),
                    status.ownedBySelf(),
                    status.holderId().orElse(null),
                    status.leaseAge().map(age -> age.toMillis()).orElse(null)
            );
        }
    }

    public record AcquireResponse(
            String resourceId,
            boolean acquired,
            String holderId,
            Long renewedAt,
            String error,
            boolean retryable
    ) {
        static AcquireResponse acquired(LockRecord record) {
            return new AcquireResponse(record.resourceId(), true, record.ownerId(),
                    record.renewedAt().toEpochMilli(), null, false);
        }

        static AcquireResponse refused(String resourceId, LockError error) {
            return new AcquireResponse(resourceId, false, error.currentHolderId().orElse(null),
                    null, error.message(), error.isRetryable());
        }
    }
}
