package com.example.mmocore.util;

/**
 * The single logical thread of the simulation.
 *
 * Every periodic tick, every delayed callback and every inbound event runs on
 * it, so world state is never mutated concurrently. Delayed tasks are keyed
 * (for example {@code "respawn:" + monsterId}); scheduling a key that is
 * already pending replaces the earlier task. A task must look its entity up
 * again when it fires and do nothing if it is gone.
 */
public interface GameScheduler {

    /**
     * Current time in epoch milliseconds, as seen by the simulation.
     */
    long now();

    /**
     * Register a named periodic task.
     */
    void scheduleAtFixedRate(String name, Runnable task, long initialDelayMs, long periodMs);

    /**
     * Run {@code task} once after {@code delayMs}. Replaces a pending task with the same key.
     */
    void schedule(String key, Runnable task, long delayMs);

    /**
     * Cancel a pending delayed task.
     * @return true if a pending task was cancelled
     */
    boolean cancel(String key);

    /**
     * Run {@code task} on the simulation thread as soon as possible.
     */
    void execute(Runnable task);
}
