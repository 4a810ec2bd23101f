/*
 * Copyright httproute-operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.httproute.kubernetes.operator.controller;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.httproute.tag.RunsOnThread;
import io.httproute.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>A work queue of keys, processed by a fixed number of worker threads.</p>
 *
 * <ul>
 *     <li>A key that is already waiting is not queued twice.</li>
 *     <li>A key is never handed to two workers at once. If it is added while being processed it is
 *     queued again once processing finishes, so the latest state is always observed.</li>
 *     <li>When the handler throws, the key is re-added after a per-key exponential backoff.
 *     A successful run resets the backoff.</li>
 * </ul>
 *
 * @param <K> the key type
 */
public class ReconcileQueue<K> implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconcileQueue.class);

    /**
     * Processes one key.
     * @param <K> the key type
     */
    @FunctionalInterface
    public interface KeyHandler<K> {
        /**
         * @param key the key to process
         * @throws Exception to have the key retried after a backoff
         */
        void handle(K key) throws Exception;
    }

    private final String name;
    private final int workerCount;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final KeyHandler<K> handler;

    private final Object lock = new Object();
    private final Deque<K> ready = new ArrayDeque<>();
    private final Set<K> dirty = new HashSet<>();
    private final Set<K> processing = new HashSet<>();
    private final Map<K, Integer> failures = new HashMap<>();
    private boolean shuttingDown;

    @Nullable
    private ExecutorService workers;
    private final ScheduledExecutorService retryScheduler;

    public ReconcileQueue(String name, int workerCount, Duration baseDelay, Duration maxDelay, KeyHandler<K> handler) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1");
        }
        this.name = Objects.requireNonNull(name);
        this.workerCount = workerCount;
        this.baseDelay = Objects.requireNonNull(baseDelay);
        this.maxDelay = Objects.requireNonNull(maxDelay);
        this.handler = Objects.requireNonNull(handler);
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(threadFactory(name + "-retry"));
    }

    /**
     * Starts the worker threads. Keys added before this call are retained.
     */
    public void start() {
        ExecutorService pool;
        synchronized (lock) {
            if (workers != null) {
                throw new IllegalStateException("queue " + name + " already started");
            }
            pool = Executors.newFixedThreadPool(workerCount, threadFactory(name + "-worker"));
            workers = pool;
        }
        for (int i = 0; i < workerCount; i++) {
            pool.execute(this::runWorker);
        }
        LOGGER.info("Started queue {} with {} worker(s)", name, workerCount);
    }

    /**
     * Marks the key as needing processing.
     * @param key the key
     */
    @RunsOnThread("informer callback or retry scheduler")
    public void add(K key) {
        Objects.requireNonNull(key);
        synchronized (lock) {
            if (shuttingDown || !dirty.add(key)) {
                return;
            }
            if (processing.contains(key)) {
                // re-queued by done() once the current run finishes
                return;
            }
            ready.addLast(key);
            lock.notifyAll();
        }
    }

    /**
     * Adds the key once the given delay has elapsed.
     * @param key the key
     * @param delay how long to wait
     */
    public void addAfter(K key, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            add(key);
            return;
        }
        synchronized (lock) {
            if (shuttingDown) {
                return;
            }
            retryScheduler.schedule(() -> add(key), delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /**
     * @return the number of keys waiting to be picked up by a worker
     */
    public int depth() {
        synchronized (lock) {
            return ready.size();
        }
    }

    @VisibleForTesting
    int failureCount(K key) {
        synchronized (lock) {
            return failures.getOrDefault(key, 0);
        }
    }

    @VisibleForTesting
    Duration backoffFor(int failureCount) {
        // failureCount starts at 1 for the first failure
        long multiplier = 1L << Math.min(failureCount - 1, 30);
        Duration delay = baseDelay.multipliedBy(multiplier);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    @RunsOnThread("reconciliation worker")
    private void runWorker() {
        while (true) {
            K key;
            try {
                key = take();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (key == null) {
                return;
            }
            try {
                process(key);
            }
            finally {
                done(key);
            }
        }
    }

    @Nullable
    private K take() throws InterruptedException {
        synchronized (lock) {
            while (ready.isEmpty() && !shuttingDown) {
                lock.wait();
            }
            if (shuttingDown) {
                return null;
            }
            K key = ready.pollFirst();
            dirty.remove(key);
            processing.add(key);
            return key;
        }
    }

    private void process(K key) {
        try {
            handler.handle(key);
            synchronized (lock) {
                failures.remove(key);
            }
        }
        catch (Exception e) {
            Duration delay;
            synchronized (lock) {
                int count = failures.merge(key, 1, Integer::sum);
                delay = backoffFor(count);
            }
            LOGGER.atWarn()
                    .setMessage("Processing {} failed, retrying in {}ms: {}")
                    .addArgument(key)
                    .addArgument(delay::toMillis)
                    .addArgument(e::toString)
                    .setCause(LOGGER.isDebugEnabled() ? e : null)
                    .log();
            addAfter(key, delay);
        }
    }

    private void done(K key) {
        synchronized (lock) {
            processing.remove(key);
            if (dirty.contains(key) && !shuttingDown) {
                ready.addLast(key);
                lock.notifyAll();
            }
        }
    }

    /**
     * Stops accepting keys, waits briefly for in-flight work and stops the workers.
     */
    @Override
    public void close() {
        ExecutorService toStop;
        synchronized (lock) {
            shuttingDown = true;
            lock.notifyAll();
            toStop = workers;
        }
        retryScheduler.shutdownNow();
        if (toStop != null) {
            toStop.shutdown();
            try {
                if (!toStop.awaitTermination(10, TimeUnit.SECONDS)) {
                    toStop.shutdownNow();
                }
            }
            catch (InterruptedException e) {
                toStop.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        LOGGER.info("Stopped queue {}", name);
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
