package com.example.khaznati_backend.service;

import com.example.khaznati_backend.config.StorageProperties;
import com.example.khaznati_backend.exception.BackendUnavailableException;
import com.example.khaznati_backend.exception.StorageException;
import com.example.khaznati_backend.exception.ThrottledException;
import com.example.khaznati_backend.exception.TransferCancelledException;
import com.example.khaznati_backend.exception.TransferTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the chunk operations of one upload or download against the backend.
 * <ul>
 *     <li>at most {@code maxConcurrentChunks} operations are in flight; items are pulled from the source
 *     iterator only when a slot frees up, so memory stays bounded by the window</li>
 *     <li>a {@link ThrottledException} pauses new dispatches for the whole operation; the throttled chunk
 *     waits out the cooldown and is tried again. {@code maxThrottleWaits} bounds the number of cooldowns,
 *     not the number of throttled chunks</li>
 *     <li>retryable failures get {@code maxAttempts} attempts per chunk; anything else fails the operation</li>
 *     <li>after the first failure nothing new is dispatched and in-flight work is awaited before throwing</li>
 * </ul>
 * Completion callbacks run one at a time, also for chunks that finish after the operation failed.
 */
@Component
public class ChunkTransferPolicy {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkTransferPolicy.class);
    private static final long POLL_MILLIS = 200;
    private static final Duration MAX_SLEEP_SLICE = Duration.ofSeconds(1);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    @FunctionalInterface
    public interface ChunkTask<I, T> {
        T run(I item);
    }

    @FunctionalInterface
    public interface ChunkCompletion<I, T> {
        void accept(I item, T result) throws IOException;
    }

    private final Executor executor;
    private final int maxConcurrentChunks;
    private final int maxAttempts;
    private final int maxThrottleWaits;
    private final Clock clock;
    private final Sleeper sleeper;

    @Autowired
    public ChunkTransferPolicy(@Qualifier("transferTaskExecutor") Executor executor, StorageProperties props, Clock clock) {
        this(executor, props.getMaxConcurrentChunks(), props.getMaxAttempts(), props.getMaxThrottleWaits(), clock,
                d -> Thread.sleep(Math.max(1, d.toMillis())));
    }

    public ChunkTransferPolicy(Executor executor, int maxConcurrentChunks, int maxAttempts, int maxThrottleWaits,
                               Clock clock, Sleeper sleeper) {
        this.executor = executor;
        this.maxConcurrentChunks = Math.max(1, maxConcurrentChunks);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.maxThrottleWaits = Math.max(0, maxThrottleWaits);
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public int getMaxConcurrentChunks() {
        return maxConcurrentChunks;
    }

    /**
     * Applies {@code task} to every item and hands each result to {@code onDone}.
     *
     * @param operation label used in log lines, e.g. {@code upload file=...}
     * @param deadline  absolute deadline for the whole operation, or {@code null} for none
     * @return number of items dispatched
     * @throws StorageException the first failure of the operation
     */
    public <I, T> int run(String operation,
                          Iterator<I> items,
                          ChunkTask<I, T> task,
                          ChunkCompletion<I, T> onDone,
                          TransferControl control,
                          Instant deadline) {
        Operation op = new Operation(operation, deadline, control);
        Semaphore window = new Semaphore(maxConcurrentChunks);
        Object completionLock = new Object();
        List<CompletableFuture<Void>> inFlight = new ArrayList<>();
        int dispatched = 0;

        LOGGER.debug("TRANSFER START op={} window={} maxAttempts={}", operation, maxConcurrentChunks, maxAttempts);
        while (!op.failed()) {
            try {
                op.checkCancelled();
                op.checkDeadline();
                if (!items.hasNext()) {
                    break;
                }
                awaitPause(op);
                if (!acquire(window, op)) {
                    break;
                }
            } catch (RuntimeException e) {
                op.fail(e);
                break;
            }

            I item;
            try {
                item = items.next();
            } catch (RuntimeException e) {
                window.release();
                op.fail(new StorageException("Reading chunk source failed for " + operation, e));
                break;
            }
            dispatched++;
            try {
                inFlight.add(CompletableFuture.runAsync(() -> {
                    try {
                        T result = attempt(op, item, task);
                        // still reported after a failure so the caller can clean up what was stored
                        synchronized (completionLock) {
                            onDone.accept(item, result);
                        }
                    } catch (IOException e) {
                        op.fail(new StorageException("Writing chunk result failed for " + operation, e));
                    } catch (RuntimeException e) {
                        op.fail(e);
                    } finally {
                        window.release();
                    }
                }, executor));
            } catch (RejectedExecutionException e) {
                window.release();
                op.fail(new BackendUnavailableException("Transfer executor rejected chunk task for " + operation, e, true));
            }
        }

        awaitInFlight(op, inFlight);
        RuntimeException failure = op.failure.get();
        if (failure != null) {
            LOGGER.warn("TRANSFER FAIL op={} dispatched={} err={}", operation, dispatched, failure.toString());
            throw failure;
        }
        LOGGER.debug("TRANSFER DONE op={} chunks={} throttleWaits={}", operation, dispatched, op.throttleWaits.get());
        return dispatched;
    }

    private <I, T> T attempt(Operation op, I item, ChunkTask<I, T> task) {
        int failures = 0;
        while (true) {
            if (op.failed()) {
                throw new TransferCancelledException("Operation " + op.name + " already failed");
            }
            op.checkDeadline();
            awaitPause(op);
            try {
                return task.run(item);
            } catch (ThrottledException e) {
                // chunks throttled while a cooldown is already running share that wait
                if (op.pauseFor(e.getRetryAfter())) {
                    int waits = op.throttleWaits.incrementAndGet();
                    if (waits > maxThrottleWaits) {
                        throw new BackendUnavailableException(
                                "Backend still throttled after %d waits (op=%s)".formatted(maxThrottleWaits, op.name), e);
                    }
                    LOGGER.warn("TRANSFER THROTTLED op={} wait={}s waits={}/{}",
                            op.name, e.getRetryAfter().toSeconds(), waits, maxThrottleWaits);
                }
            } catch (StorageException e) {
                failures++;
                if (!e.isRetryable() || failures >= maxAttempts) {
                    throw e;
                }
                LOGGER.warn("TRANSFER RETRY op={} attempt={}/{} err={}", op.name, failures + 1, maxAttempts, e.getMessage());
            }
        }
    }

    private void awaitPause(Operation op) {
        while (true) {
            Duration remaining = Duration.between(clock.instant(), op.pauseUntil);
            if (remaining.isZero() || remaining.isNegative()) {
                return;
            }
            if (op.deadline != null && op.pauseUntil.isAfter(op.deadline)) {
                throw new TransferTimeoutException("Cooldown of %ds exceeds the deadline of %s"
                        .formatted(remaining.toSeconds(), op.name));
            }
            op.checkCancelled();
            try {
                sleeper.sleep(remaining.compareTo(MAX_SLEEP_SLICE) > 0 ? MAX_SLEEP_SLICE : remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransferCancelledException("Interrupted while waiting for cooldown (op=" + op.name + ")");
            }
        }
    }

    private boolean acquire(Semaphore window, Operation op) {
        try {
            while (!window.tryAcquire(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (op.failed()) {
                    return false;
                }
                op.checkCancelled();
                op.checkDeadline();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferCancelledException("Interrupted while waiting for a transfer slot (op=" + op.name + ")");
        }
        if (op.failed()) {
            window.release();
            return false;
        }
        return true;
    }

    private void awaitInFlight(Operation op, List<CompletableFuture<Void>> inFlight) {
        CompletableFuture<Void> all = CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0]));
        try {
            if (op.deadline == null) {
                all.get();
            } else {
                long millis = Math.max(1, Duration.between(clock.instant(), op.deadline).toMillis());
                all.get(millis, TimeUnit.MILLISECONDS);
            }
        } catch (TimeoutException e) {
            op.fail(new TransferTimeoutException("In-flight chunks of " + op.name + " did not finish before the deadline", e));
        } catch (ExecutionException e) {
            op.fail(new StorageException("Chunk task crashed in " + op.name, e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            op.fail(new TransferCancelledException("Interrupted while awaiting chunks of " + op.name));
        }
    }

    private final class Operation {
        private final String name;
        private final Instant deadline;
        private final TransferControl control;
        private final AtomicReference<RuntimeException> failure = new AtomicReference<>();
        private final AtomicInteger throttleWaits = new AtomicInteger();
        private volatile Instant pauseUntil = Instant.EPOCH;

        private Operation(String name, Instant deadline, TransferControl control) {
            this.name = name;
            this.deadline = deadline;
            this.control = control;
        }

        boolean failed() {
            return failure.get() != null;
        }

        void fail(RuntimeException e) {
            failure.compareAndSet(null, e);
        }

        /** Extends the cooldown. Returns true when no cooldown was running, i.e. this starts a new wait. */
        synchronized boolean pauseFor(Duration wait) {
            Instant now = clock.instant();
            boolean fresh = !pauseUntil.isAfter(now);
            Instant candidate = now.plus(wait);
            if (candidate.isAfter(pauseUntil)) {
                pauseUntil = candidate;
            }
            return fresh;
        }

        void checkCancelled() {
            if (control != null && control.isCancelled()) {
                throw new TransferCancelledException("Operation " + name + " was cancelled");
            }
        }

        void checkDeadline() {
            if (deadline != null && clock.instant().isAfter(deadline)) {
                throw new TransferTimeoutException("Operation " + name + " exceeded its deadline");
            }
        }
    }
}
