package com.shelfmark.app.thumbnail;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A fixed worker pool with a bounded queue and a per-task deadline. An asset is queued at
 * most once per lane; a task that overruns its deadline has its worker interrupted.
 */
final class RenderLane implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RenderLane.class);

    private final String name;
    private final Duration timeout;
    private final ThreadPoolExecutor pool;
    private final ScheduledExecutorService watchdog;
    private final Set<AssetKey> inFlight = ConcurrentHashMap.newKeySet();

    RenderLane(String name, int workers, int queueCapacity, Duration timeout) {
        this.name = name;
        this.timeout = timeout;
        this.pool = new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                namedFactory("shelfmark-render-" + name + "-"),
                new ThreadPoolExecutor.AbortPolicy());
        this.watchdog = Executors.newSingleThreadScheduledExecutor(namedFactory("shelfmark-watchdog-" + name + "-"));
    }

    String name() {
        return name;
    }

    Duration timeout() {
        return timeout;
    }

    /**
     * @return false if the asset is already in this lane or the queue is full
     */
    boolean submit(AssetKey key, Runnable work) {
        if (!inFlight.add(key)) {
            return false;
        }
        try {
            pool.execute(() -> runGuarded(key, work));
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(key);
            return false;
        }
    }

    boolean contains(AssetKey key) {
        return inFlight.contains(key);
    }

    /** Queued plus running. */
    int pending() {
        return inFlight.size();
    }

    private void runGuarded(AssetKey key, Runnable work) {
        Deadline deadline = new Deadline(Thread.currentThread());
        ScheduledFuture<?> timer = watchdog.schedule(() -> {
            if (deadline.expire()) {
                logger.warn("{} lane: {} exceeded {}s, interrupting", name, key, timeout.toSeconds());
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            work.run();
        } catch (RuntimeException e) {
            logger.error("{} lane: render task for {} failed", name, key, e);
        } finally {
            deadline.finish();
            timer.cancel(false);
            // an expired deadline must not leak into the next task on this worker
            Thread.interrupted();
            inFlight.remove(key);
        }
    }

    @Override
    public void close() {
        pool.shutdownNow();
        watchdog.shutdownNow();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("{} lane: workers still running after shutdown", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Interrupts the worker only while its task is still running. */
    private static final class Deadline {
        private final Thread worker;
        private boolean finished;

        Deadline(Thread worker) {
            this.worker = worker;
        }

        synchronized boolean expire() {
            if (finished) {
                return false;
            }
            worker.interrupt();
            return true;
        }

        synchronized void finish() {
            finished = true;
        }
    }

    private static ThreadFactory namedFactory(String prefix) {
        return new ThreadFactory() {
            private final ThreadFactory base = Executors.defaultThreadFactory();
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override public Thread newThread(Runnable r) {
                Thread t = base.newThread(r);
                t.setName(prefix + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
    }
}
