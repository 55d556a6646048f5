package com.guardianintel.claims.features.claims.sync;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.guardianintel.claims.exception.ClaimsException;
import com.guardianintel.claims.features.claims.model.ClaimStatus;
import com.guardianintel.claims.features.claims.model.InsuranceClaim;
import com.guardianintel.claims.features.claims.repository.ClaimRepository;
import com.guardianintel.claims.features.claims.service.ClaimSyncService;
import com.guardianintel.claims.features.claims.service.SyncOutcome;
import com.guardianintel.claims.integration.carrier.CarrierCapabilityRegistry;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodically syncs every filed, non-terminal claim whose carrier supports status
 * sync. Each carrier's claims run as one batch on its own worker, so an outage at
 * one carrier never delays another. Within a batch, each claim is retried with
 * exponential backoff on retryable failures and timeouts; after
 * {@code claims.sync.max-consecutive-failures} failed claims in a row the rest of
 * that carrier's batch is skipped until the next sweep.
 */
@Component
@Slf4j
public class CarrierSyncSweeper {

    private final ClaimRepository repository;
    private final ClaimSyncService syncService;
    private final CarrierCapabilityRegistry registry;
    private final ExecutorService executor;
    private final Clock clock;
    private final RetryConfig retryConfig;
    private final int maxConsecutiveFailures;
    private final boolean enabled;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public CarrierSyncSweeper(ClaimRepository repository,
                              ClaimSyncService syncService,
                              CarrierCapabilityRegistry registry,
                              @Qualifier("carrierSweepExecutor") ExecutorService executor,
                              Clock clock,
                              @Value("${claims.sync.enabled:true}") boolean enabled,
                              @Value("${claims.sync.retry.max-attempts:3}") int maxAttempts,
                              @Value("${claims.sync.retry.initial-backoff:1s}") Duration initialBackoff,
                              @Value("${claims.sync.retry.multiplier:2.0}") double multiplier,
                              @Value("${claims.sync.max-consecutive-failures:3}") int maxConsecutiveFailures) {
        this.repository = repository;
        this.syncService = syncService;
        this.registry = registry;
        this.executor = executor;
        this.clock = clock;
        this.enabled = enabled;
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.retryConfig = RetryConfig.<SyncOutcome>custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier))
                .retryOnException(e -> e instanceof ClaimsException ce && ce.isRetryable())
                .retryOnResult(SyncOutcome::timedOut)
                .failAfterMaxAttempts(false)
                .build();
    }

    @Scheduled(fixedDelayString = "${claims.sync.sweep-interval:PT15M}",
               initialDelayString = "${claims.sync.initial-delay:PT1M}")
    public void scheduledSweep() {
        if (!enabled) {
            return;
        }
        SweepReport report = sweep();
        log.info("Carrier sweep finished: {} candidates, {} synced, {} changed, {} conflicts, {} timed out, {} failed, skipped carriers {}",
                report.candidates(), report.synced(), report.statusChanges(), report.conflicts(),
                report.timedOut(), report.failed(), report.skippedCarriers());
    }

    /**
     * Runs one sweep and waits for every carrier batch to finish. A sweep that is
     * already running is not started twice; the second caller gets an empty report.
     */
    public SweepReport sweep() {
        Instant started = clock.instant();
        if (!running.compareAndSet(false, true)) {
            log.warn("Carrier sweep already in progress; skipping");
            return new SweepReport(started, started, 0, 0, 0, 0, 0, 0, 0, List.of(), List.of("sweep already running"));
        }
        try {
            Map<String, List<InsuranceClaim>> byCarrier = candidatesByCarrier();
            int candidates = byCarrier.values().stream().mapToInt(List::size).sum();
            log.info("Entering carrier sweep: {} claims across {} carriers", candidates, byCarrier.size());

            Map<String, Future<BatchResult>> futures = new LinkedHashMap<>();
            byCarrier.forEach((carrier, claims) ->
                    futures.put(carrier, executor.submit(() -> runBatch(carrier, claims))));

            BatchResult total = new BatchResult();
            for (Map.Entry<String, Future<BatchResult>> entry : futures.entrySet()) {
                try {
                    total.merge(entry.getValue().get());
                } catch (ExecutionException e) {
                    log.error("Sweep batch for {} crashed", entry.getKey(), e.getCause());
                    total.errors.add(entry.getKey() + ": " + e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    futures.values().forEach(f -> f.cancel(true));
                    total.errors.add("sweep interrupted");
                    break;
                }
            }

            return new SweepReport(started, clock.instant(), candidates, total.synced, total.statusChanges,
                    total.conflicts, total.timedOut, total.failed, total.skippedClaims, total.skippedCarriers, total.errors);
        } finally {
            running.set(false);
        }
    }

    private Map<String, List<InsuranceClaim>> candidatesByCarrier() {
        Map<String, List<InsuranceClaim>> byCarrier = new LinkedHashMap<>();
        for (InsuranceClaim claim : repository.findByFiledWithCarrierTrueAndStatusNotIn(
                EnumSet.of(ClaimStatus.CLOSED, ClaimStatus.DENIED))) {
            if (registry.supportsStatusSync(claim.getCarrier())) {
                byCarrier.computeIfAbsent(claim.getCarrier(), c -> new ArrayList<>()).add(claim);
            }
        }
        return byCarrier;
    }

    BatchResult runBatch(String carrier, List<InsuranceClaim> claims) {
        Retry retry = Retry.of("carrier-sync-" + carrier, retryConfig);
        retry.getEventPublisher().onRetry(event ->
                log.debug("[{}] retry #{} after {}", carrier, event.getNumberOfRetryAttempts(), event.getWaitInterval()));

        BatchResult result = new BatchResult();
        int consecutiveFailures = 0;

        for (int i = 0; i < claims.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                result.skippedClaims += claims.size() - i;
                break;
            }
            if (consecutiveFailures >= maxConsecutiveFailures) {
                int remaining = claims.size() - i;
                log.warn("[{}] {} consecutive failures; skipping remaining {} claims", carrier, consecutiveFailures, remaining);
                result.skippedCarriers.add(carrier);
                result.skippedClaims += remaining;
                break;
            }

            Long claimId = claims.get(i).getId();
            try {
                SyncOutcome outcome = Retry.decorateSupplier(retry,
                        () -> syncService.sync(claimId, ClaimSyncService.SYSTEM_ACTOR)).get();
                if (outcome.timedOut()) {
                    result.timedOut++;
                    consecutiveFailures++;
                    continue;
                }
                result.synced++;
                if (outcome.statusChanged()) result.statusChanges++;
                if (outcome.hasConflict()) result.conflicts++;
                consecutiveFailures = 0;
            } catch (RuntimeException e) {
                result.failed++;
                consecutiveFailures++;
                result.errors.add("claim " + claimId + ": " + e.getMessage());
                log.error("[{}] sync of claim {} failed: {}", carrier, claimId, e.getMessage());
            }
        }
        return result;
    }

    static final class BatchResult {
        int synced;
        int statusChanges;
        int conflicts;
        int timedOut;
        int failed;
        int skippedClaims;
        final List<String> skippedCarriers = new ArrayList<>();
        final List<String> errors = new ArrayList<>();

        void merge(BatchResult other) {
            synced += other.synced;
            statusChanges += other.statusChanges;
            conflicts += other.conflicts;
            timedOut += other.timedOut;
            failed += other.failed;
            skippedClaims += other.skippedClaims;
            skippedCarriers.addAll(other.skippedCarriers);
            errors.addAll(other.errors);
        }
    }
}
