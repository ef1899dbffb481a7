package com.timexforecast.service;

import com.timexforecast.exception.CandidateTimeoutException;
import com.timexforecast.exception.TimexForecastException;
import com.timexforecast.exception.UnexpectedModelException;
import com.timexforecast.model.ModelVariant;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs one task per candidate on a bounded pool owned by a single pipeline
 * invocation. Each task's timeout counts from the moment it starts running,
 * not from submission. A task that overruns is cancelled with an interrupt
 * and reported as {@link CandidateTimeoutException}; any failure stays with
 * its candidate. Outcomes come back in submission order.
 */
@Slf4j
public class CandidateTaskRunner implements AutoCloseable {

    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final ExecutorService executor;
    private final int poolSize;
    private final Duration timeout;

    public CandidateTaskRunner(int poolSize, Duration timeout) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be >= 1, got: " + poolSize);
        }
        this.poolSize = poolSize;
        this.timeout = timeout;
        this.executor = Executors.newFixedThreadPool(poolSize, threadFactory());
    }

    public <T> List<Outcome<T>> runAll(List<ModelVariant> candidates, Function<ModelVariant, T> task) {
        long timeoutNanos = timeout.toNanos();
        int rounds = (candidates.size() + poolSize - 1) / poolSize;
        long startDeadline = System.nanoTime() + timeoutNanos * (rounds + 1L);

        List<Submitted<T>> submitted = new ArrayList<>(candidates.size());
        for (ModelVariant candidate : candidates) {
            CompletableFuture<Long> started = new CompletableFuture<>();
            Future<T> future = executor.submit(() -> {
                started.complete(System.nanoTime());
                return task.apply(candidate);
            });
            submitted.add(new Submitted<>(candidate, started, future));
        }

        List<Outcome<T>> outcomes = new ArrayList<>(submitted.size());
        for (Submitted<T> s : submitted) {
            outcomes.add(await(s, timeoutNanos, startDeadline));
        }
        return outcomes;
    }

    private <T> Outcome<T> await(Submitted<T> s, long timeoutNanos, long startDeadline) {
        try {
            long startedAt = s.started().get(Math.max(0L, startDeadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            long remaining = timeoutNanos - (System.nanoTime() - startedAt);
            return Outcome.success(s.candidate(), s.future().get(Math.max(0L, remaining), TimeUnit.NANOSECONDS));
        } catch (TimeoutException ex) {
            s.future().cancel(true);
            log.warn("Candidate timed out | model={} | timeoutMs={}", s.candidate(), timeout.toMillis());
            return Outcome.failure(s.candidate(), new CandidateTimeoutException(s.candidate().name(), timeout));
        } catch (ExecutionException ex) {
            return Outcome.failure(s.candidate(), unwrap(s.candidate(), ex.getCause()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            s.future().cancel(true);
            return Outcome.failure(s.candidate(),
                new UnexpectedModelException("Interrupted while waiting for " + s.candidate(), ex));
        }
    }

    private TimexForecastException unwrap(ModelVariant candidate, Throwable cause) {
        if (cause instanceof TimexForecastException known) {
            return known;
        }
        log.error("Unexpected failure in model {}: {}", candidate, cause.getMessage(), cause);
        return new UnexpectedModelException("Model " + candidate + " failed unexpectedly: "
            + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()), cause);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static ThreadFactory threadFactory() {
        int pool = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger thread = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "timex-candidate-" + pool + "-" + thread.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record Submitted<T>(ModelVariant candidate, CompletableFuture<Long> started, Future<T> future) {}

    /**
     * Result of one candidate task: a value, or the failure that excluded it.
     */
    public record Outcome<T>(ModelVariant candidate, T value, TimexForecastException failure) {

        static <T> Outcome<T> success(ModelVariant candidate, T value) {
            return new Outcome<>(candidate, value, null);
        }

        static <T> Outcome<T> failure(ModelVariant candidate, TimexForecastException failure) {
            return new Outcome<>(candidate, null, failure);
        }

        public boolean succeeded() {
            return failure == null;
        }

        public boolean timedOut() {
            return failure instanceof CandidateTimeoutException;
        }
    }
}
