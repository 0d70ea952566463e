package com.sitecraft.schedule;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the tasks of one phase on a bounded pool sized by a {@link SchedulingDecision}.
 * <p>
 * Tasks must not throw; they report failures in their result. Results come back in input order. When the
 * cancellation token fires, tasks that have not started are skipped and running ones complete. When a
 * ceiling is configured, a task still running that long after it started is interrupted and reported as
 * timed out.
 */
public class PhaseExecutor {
    private static final Logger log = LoggerFactory.getLogger(PhaseExecutor.class);

    private final long ceilingMillis;

    public PhaseExecutor(long ceilingMillis) {
        this.ceilingMillis = ceilingMillis;
    }

    public <T, R> PhaseRun<T, R> run(SchedulingDecision decision, List<T> items, Function<T, R> task, CancellationToken cancellation)
            throws InterruptedException {
        if (items.isEmpty()) {
            return new PhaseRun<>(List.of(), List.of(), List.of());
        }
        if (!decision.parallel() && ceilingMillis <= 0) {
            return runInline(items, task, cancellation);
        }
        return runPooled(decision, items, task, cancellation);
    }

    private <T, R> PhaseRun<T, R> runInline(List<T> items, Function<T, R> task, CancellationToken cancellation) {
        List<R> completed = new ArrayList<>(items.size());
        List<T> skipped = new ArrayList<>();
        for (T item : items) {
            if (cancellation.isCancelled()) {
                skipped.add(item);
                continue;
            }
            completed.add(task.apply(item));
        }
        return new PhaseRun<>(completed, skipped, List.of());
    }

    private <T, R> PhaseRun<T, R> runPooled(SchedulingDecision decision, List<T> items, Function<T, R> task, CancellationToken cancellation)
            throws InterruptedException {
        int workers = Math.max(1, decision.workers());
        ExecutorService pool = Executors.newFixedThreadPool(workers, threadFactory(decision.phase()));
        List<Future<Optional<R>>> futures = new ArrayList<>(items.size());
        AtomicLongArray startedAt = new AtomicLongArray(items.size());
        try {
            for (int i = 0; i < items.size(); i++) {
                int index = i;
                T item = items.get(i);
                futures.add(pool.submit(() -> {
                    if (cancellation.isCancelled()) {
                        return Optional.<R>empty();
                    }
                    startedAt.set(index, System.nanoTime());
                    return Optional.ofNullable(task.apply(item));
                }));
            }
            pool.shutdown();

            List<R> completed = new ArrayList<>(items.size());
            List<T> skipped = new ArrayList<>();
            List<T> timedOut = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                Future<Optional<R>> future = futures.get(i);
                T item = items.get(i);
                try {
                    Optional<R> result = await(future, startedAt, i);
                    if (result.isPresent()) {
                        completed.add(result.get());
                    } else {
                        skipped.add(item);
                    }
                } catch (TimeoutException e) {
                    future.cancel(true);
                    timedOut.add(item);
                } catch (CancellationException e) {
                    timedOut.add(item);
                } catch (ExecutionException e) {
                    throw new IllegalStateException("Task of phase " + decision.phase().key() + " threw instead of reporting", e.getCause());
                }
            }
            if (!timedOut.isEmpty()) {
                log.warn("phase.ceiling phase={} ceilingMs={} timedOut={}", decision.phase().key(), ceilingMillis, timedOut.size());
            }
            return new PhaseRun<>(completed, skipped, timedOut);
        } finally {
            if (!pool.isTerminated()) {
                pool.shutdownNow();
            }
        }
    }

    /**
     * Waits for one task. The ceiling counts from the moment the task started running, so time spent queued
     * behind other tasks does not count against it.
     */
    private <R> Optional<R> await(Future<Optional<R>> future, AtomicLongArray startedAt, int index)
            throws InterruptedException, ExecutionException, TimeoutException {
        if (ceilingMillis <= 0) {
            return future.get();
        }
        long ceilingNanos = TimeUnit.MILLISECONDS.toNanos(ceilingMillis);
        while (true) {
            long started = startedAt.get(index);
            long wait = started == 0L ? ceilingNanos : started + ceilingNanos - System.nanoTime();
            try {
                return future.get(Math.max(1L, wait), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                started = startedAt.get(index);
                if (started != 0L && System.nanoTime() - started >= ceilingNanos) {
                    throw e;
                }
            }
        }
    }

    private static ThreadFactory threadFactory(Phase phase) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "sitecraft-" + phase.key() + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * @param completed results of tasks that ran, in input order
     * @param skipped items never started because the cycle was cancelled
     * @param timedOut items still running when the ceiling expired
     */
    public record PhaseRun<T, R>(List<R> completed, List<T> skipped, List<T> timedOut) {
    }
}
