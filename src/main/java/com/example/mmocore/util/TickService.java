package com.example.mmocore.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link GameScheduler} backed by a single-threaded scheduled executor, which
 * serializes ticks, timers and inbound events.
 */
public class TickService implements GameScheduler {
    private static final Logger logger = LoggerFactory.getLogger(TickService.class);

    private final ScheduledExecutorService scheduler;
    private final Map<String, ScheduledFuture<?>> periodic = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> delayed = new ConcurrentHashMap<>();

    public TickService() {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mmocore-tick");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public long now() {
        return System.currentTimeMillis();
    }

    @Override
    public void scheduleAtFixedRate(String name, Runnable task, long initialDelayMs, long periodMs) {
        ScheduledFuture<?> f = scheduler.scheduleAtFixedRate(guarded(name, task), initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = periodic.put(name, f);
        if (previous != null) previous.cancel(false);
        logger.info("[tick] '{}' scheduled every {}ms", name, periodMs);
    }

    @Override
    public void schedule(String key, Runnable task, long delayMs) {
        Runnable body = guarded(key, task);
        ScheduledFuture<?>[] holder = new ScheduledFuture<?>[1];
        holder[0] = scheduler.schedule(() -> {
            delayed.remove(key, holder[0]);
            body.run();
        }, delayMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = delayed.put(key, holder[0]);
        if (previous != null) previous.cancel(false);
    }

    @Override
    public boolean cancel(String key) {
        ScheduledFuture<?> f = delayed.remove(key);
        if (f == null) return false;
        return f.cancel(false);
    }

    @Override
    public void execute(Runnable task) {
        scheduler.execute(guarded("inbound", task));
    }

    public int getPendingDelayedCount() {
        return delayed.size();
    }

    public void shutdown() {
        for (ScheduledFuture<?> f : periodic.values()) f.cancel(false);
        for (ScheduledFuture<?> f : delayed.values()) f.cancel(false);
        periodic.clear();
        delayed.clear();
        scheduler.shutdownNow();
        logger.info("[tick] scheduler stopped");
    }

    /**
     * Log and swallow task failures; an uncaught exception cancels a periodic task.
     */
    private static Runnable guarded(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("[tick] task '{}' failed: {}", name, e.getMessage(), e);
            }
        };
    }
}
