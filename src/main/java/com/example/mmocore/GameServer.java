package com.example.mmocore;

import com.example.mmocore.net.Connection;
import com.example.mmocore.net.SessionHandler;
import com.example.mmocore.net.handlers.EventDispatcher;
import com.example.mmocore.persistence.GameDataLoader;
import com.example.mmocore.persistence.H2ProfileStore;
import com.example.mmocore.persistence.ProfileWriter;
import com.example.mmocore.persistence.ServerConfig;
import com.example.mmocore.util.TickService;
import com.example.mmocore.world.WorldDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.CountDownLatch;

/**
 * Process entry point: loads configuration and world data, opens the profile
 * store and starts the simulation ticks. A transport adapter obtains one
 * {@link SessionHandler} per client through {@link #openSession(Connection)}.
 */
public class GameServer {
    private static final Logger logger = LoggerFactory.getLogger(GameServer.class);

    private final TickService tickService;
    private final ProfileWriter profileWriter;
    private final GameServices services;
    private final EventDispatcher dispatcher;

    public GameServer(ServerConfig config, WorldDefinition definition) {
        this.tickService = new TickService();
        this.profileWriter = new ProfileWriter(new H2ProfileStore(config.getProfileDbUrl()));
        this.services = new GameServices(config, definition, tickService, profileWriter, new Random());
        this.dispatcher = EventDispatcher.createDefault();
    }

    public void start() {
        services.start();
        logger.info("[startup] simulation core running ({} maps)", services.definition.getMaps().size());
    }

    /**
     * Create the session for a newly connected client.
     */
    public SessionHandler openSession(Connection connection) {
        logger.debug("[startup] session opened for {}", connection.getId());
        return new SessionHandler(connection, services, dispatcher);
    }

    public GameServices getServices() {
        return services;
    }

    public void shutdown() {
        logger.info("[startup] shutting down");
        tickService.shutdown();
        profileWriter.shutdown();
    }

    public static void main(String[] args) throws InterruptedException {
        ServerConfig config = ServerConfig.load(ServerConfig.DEFAULT_RESOURCE);
        WorldDefinition definition = GameDataLoader.loadFromResource(GameDataLoader.DEFAULT_RESOURCE);

        GameServer server = new GameServer(config, definition);
        server.start();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.shutdown();
            stopped.countDown();
        }, "mmocore-shutdown"));
        stopped.await();
    }
}
