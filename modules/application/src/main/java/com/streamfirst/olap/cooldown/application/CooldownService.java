package com.streamfirst.olap.cooldown.application;

import com.streamfirst.olap.cooldown.domain.CooldownOutcome;
import com.streamfirst.olap.cooldown.domain.Result;
import com.streamfirst.olap.cooldown.domain.StoragePolicy;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs cooldown attempts for many tablets on a worker pool. A tablet never has two
 * attempts in flight from this service, and a tablet whose last attempt failed with a
 * retryable error waits out a doubling back-off before it is scheduled again.
 */
@Slf4j
public class CooldownService implements AutoCloseable {

    private final TabletManager tabletManager;
    private final CooldownOptions options;
    private final Clock clock;
    private final ExecutorService executor;

    private final Set<Long> running = ConcurrentHashMap.newKeySet();
    private final Map<Long, Backoff> backoffs = new ConcurrentHashMap<>();

    private record Backoff(int failures, Instant notBefore) {
    }

    public CooldownService(TabletManager tabletManager, CooldownOptions options, Clock clock) {
        this.tabletManager = tabletManager;
        this.options = options;
        this.clock = clock;
        this.executor = Executors.newFixedThreadPool(options.workerThreads(), new CooldownThreadFactory());
    }

    /**
     * Runs one cooldown attempt of {@code tablet} asynchronously. If an attempt of the
     * same tablet is still running the future completes at once with
     * {@link CooldownOutcome#IN_PROGRESS}.
     */
    public CompletableFuture<Result<CooldownOutcome>> submit(Tablet tablet) {
        long tabletId = tablet.tabletId();
        if (!running.add(tabletId)) {
            log.debug("Cooldown of tablet {} is already running", tabletId);
            return CompletableFuture.completedFuture(Result.success(CooldownOutcome.IN_PROGRESS));
        }
        try {
            return CompletableFuture.supplyAsync(tablet::cooldown, executor)
                .whenComplete((result, throwable) -> {
                    running.remove(tabletId);
                    if (throwable != null) {
                        log.error("Cooldown of tablet {} failed unexpectedly", tabletId, throwable);
                        recordFailure(tabletId);
                    } else {
                        recordResult(tabletId, result);
                    }
                });
        } catch (RuntimeException e) {
            running.remove(tabletId);
            throw e;
        }
    }

    /**
     * Submits every tablet that has a storage policy and is out of its back-off window.
     */
    public List<CompletableFuture<Result<CooldownOutcome>>> cooldownAll() {
        Instant now = clock.instant();
        List<CompletableFuture<Result<CooldownOutcome>>> futures = new ArrayList<>();
        for (Tablet tablet : tabletManager.tablets()) {
            if (tablet.storagePolicyId() == StoragePolicy.NO_POLICY) {
                continue;
            }
            Backoff backoff = backoffs.get(tablet.tabletId());
            if (backoff != null && now.isBefore(backoff.notBefore())) {
                log.trace("Tablet {} backs off until {}", tablet.tabletId(), backoff.notBefore());
                continue;
            }
            futures.add(submit(tablet));
        }
        log.debug("Submitted {} cooldown attempts", futures.size());
        return futures;
    }

    /**
     * Earliest time {@link #cooldownAll()} will pick the tablet again, if it is backing off.
     */
    public Optional<Instant> nextAttemptAt(long tabletId) {
        return Optional.ofNullable(backoffs.get(tabletId)).map(Backoff::notBefore);
    }

    private void recordResult(long tabletId, Result<CooldownOutcome> result) {
        if (result.isSuccess()) {
            backoffs.remove(tabletId);
            return;
        }
        if (result.getErrorCode().map(code -> code.isRetryable()).orElse(false)) {
            Backoff backoff = recordFailure(tabletId);
            log.warn("Cooldown of tablet {} failed ({} in a row), next attempt after {}: {}",
                tabletId, backoff.failures(), backoff.notBefore(), result.getErrorMessage().orElse(""));
        }
    }

    private Backoff recordFailure(long tabletId) {
        return backoffs.compute(tabletId, (id, previous) -> {
            int failures = previous == null ? 1 : previous.failures() + 1;
            return new Backoff(failures, clock.instant().plus(delayFor(failures)));
        });
    }

    private Duration delayFor(int failures) {
        Duration delay = options.initialBackoff();
        for (int i = 1; i < failures && delay.compareTo(options.maxBackoff()) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(options.maxBackoff()) > 0 ? options.maxBackoff() : delay;
    }

    @Override
    public void close() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warn("Cooldown workers did not stop in time, interrupting");
            executor.shutdownNow();
        }
    }

    private static final class CooldownThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "cooldown-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
