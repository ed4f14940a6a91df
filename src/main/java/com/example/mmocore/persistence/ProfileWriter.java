package com.example.mmocore.persistence;

import com.example.mmocore.model.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget profile persistence. The snapshot is taken on the caller's
 * (simulation) thread and written on the writer's executor; failures are
 * logged and never reach the caller.
 */
public class ProfileWriter {
    private static final Logger logger = LoggerFactory.getLogger(ProfileWriter.class);

    private final ProfileStore store;
    private final Executor executor;

    public ProfileWriter(ProfileStore store) {
        this(store, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "mmocore-profile-writer");
            t.setDaemon(true);
            return t;
        }));
    }

    public ProfileWriter(ProfileStore store, Executor executor) {
        this.store = store;
        this.executor = executor;
    }

    public void saveAsync(Player player) {
        ProfileSnapshot snapshot = ProfileSnapshot.of(player);
        try {
            executor.execute(() -> write(snapshot));
        } catch (RejectedExecutionException e) {
            logger.error("[profiles] writer rejected save for {}: {}", snapshot.playerId(), e.getMessage());
        }
    }

    private void write(ProfileSnapshot snapshot) {
        try {
            store.save(snapshot);
            logger.debug("[profiles] saved {}", snapshot.playerId());
        } catch (RuntimeException e) {
            logger.error("[profiles] failed to save player {} on disconnect: {}", snapshot.playerId(), e.getMessage(), e);
        }
    }

    public void shutdown() {
        if (executor instanceof ExecutorService service) {
            service.shutdown();
        }
    }
}
