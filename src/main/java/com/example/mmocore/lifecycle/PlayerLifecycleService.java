package com.example.mmocore.lifecycle;

import com.example.mmocore.combat.StatCalculator;
import com.example.mmocore.event.SpawnManager;
import com.example.mmocore.model.GameMap;
import com.example.mmocore.model.HpPolicy;
import com.example.mmocore.model.Monster;
import com.example.mmocore.model.Player;
import com.example.mmocore.net.Connection;
import com.example.mmocore.net.EventType;
import com.example.mmocore.net.Messages;
import com.example.mmocore.net.OutboundMessage;
import com.example.mmocore.persistence.ProfileWriter;
import com.example.mmocore.world.AreaOfInterest;
import com.example.mmocore.world.WorldDefinition;
import com.example.mmocore.world.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Join, reconnect, map transfer and disconnect.
 *
 * Players are never destroyed. A disconnect only takes the player out of its
 * map and marks it offline; the next join with the same identity picks the
 * same record back up.
 */
public class PlayerLifecycleService {
    private static final Logger logger = LoggerFactory.getLogger(PlayerLifecycleService.class);

    private final WorldState world;
    private final WorldDefinition definition;
    private final AreaOfInterest aoi;
    private final SpawnManager spawns;
    private final StatCalculator calculator;
    private final ProfileWriter profiles;
    private final int initialStatPoints;
    private final int maxLevel;

    public PlayerLifecycleService(WorldState world, WorldDefinition definition, AreaOfInterest aoi,
                                  SpawnManager spawns, StatCalculator calculator, ProfileWriter profiles,
                                  int initialStatPoints, int maxLevel) {
        this.world = world;
        this.definition = definition;
        this.aoi = aoi;
        this.spawns = spawns;
        this.calculator = calculator;
        this.profiles = profiles;
        this.initialStatPoints = initialStatPoints;
        this.maxLevel = maxLevel;
    }

    // ===== join =====

    /**
     * Bind a connection to a player, creating the player on first join.
     *
     * @return the bound player, or null if a first join was rejected
     */
    public Player join(Connection connection, JoinRequest request) {
        Player existing = world.getPlayer(request.playerId());
        if (existing != null) {
            return reconnect(existing, connection);
        }
        return firstJoin(connection, request);
    }

    private Player firstJoin(Connection connection, JoinRequest request) {
        GameMap map = definition.getMap(request.mapId());
        if (map == null) {
            connection.send(Messages.error(EventType.PLAYER_MAP_ERROR, "Map does not exist."));
            return null;
        }
        // client-reported progress is bounded: level to the cap, XP to below the next threshold
        int level = Math.max(1, Math.min(maxLevel, request.level()));
        int xp = Math.max(0, Math.min(Player.xpToLevel(level) - 1, request.xp()));
        if (!map.allowsLevel(level)) {
            connection.send(Messages.error(EventType.PLAYER_MAP_ERROR, levelGateMessage(map)));
            return null;
        }

        Player player = new Player(request.playerId(), request.name(), request.classKey(),
                level, xp, map.getId(), request.x(), request.y());
        player.grantStatPoints(initialStatPoints);
        player.bind(connection);
        world.upsertPlayer(player);
        calculator.apply(player, HpPolicy.FULL_HEAL);

        enterMap(player, map.getId());
        sendSelfState(player);
        sendMapSnapshot(player);
        announce(player);
        logger.info("[join] {} ({}) joined {} on connection {}",
                player.getId(), player.getName(), map.getId(), connection.getId());
        return player;
    }

    private Player reconnect(Player player, Connection connection) {
        boolean wasMember = world.isMember(player);
        player.bind(connection);
        calculator.apply(player, HpPolicy.PRESERVE_RATIO);

        if (!wasMember) {
            enterMap(player, player.getMapId());
        }
        sendSelfState(player);
        sendMapSnapshot(player);
        if (!wasMember) {
            announce(player);
        }
        logger.info("[join] {} reconnected to {} on connection {}", player.getId(), player.getMapId(), connection.getId());
        return player;
    }

    // ===== map transfer =====

    /**
     * Move a player to another map. Destination and level gate are checked
     * before anything changes. A transfer to the current map only repositions.
     *
     * @param x destination x, or null for the map's spawn point
     * @param y destination y, or null for the map's spawn point
     * @return true if the player moved
     */
    public boolean changeMap(Player player, String mapId, Double x, Double y) {
        if (player.isDead()) return false;
        GameMap target = definition.getMap(mapId);
        if (target == null) {
            aoi.sendTo(player, Messages.error(EventType.PLAYER_MAP_ERROR, "Map does not exist."));
            return false;
        }
        if (!target.allowsLevel(player.getLevel())) {
            aoi.sendTo(player, Messages.error(EventType.PLAYER_MAP_ERROR, levelGateMessage(target)));
            return false;
        }

        double nx = x != null ? x : target.getSpawnX();
        double ny = y != null ? y : target.getSpawnY();
        if (target.getId().equals(player.getMapId()) && world.isMember(player)) {
            player.setPosition(nx, ny);
            return true;
        }

        leaveMap(player, false);
        player.setPosition(nx, ny);
        enterMap(player, target.getId());
        sendMapSnapshot(player);
        announce(player);
        logger.debug("[map] {} moved to {}", player.getId(), target.getId());
        return true;
    }

    // ===== disconnect =====

    /**
     * Take the player offline. A disconnect from a connection the player is no
     * longer bound to is ignored.
     */
    public void disconnect(Player player, Connection connection) {
        if (player == null) return;
        if (player.getConnection() != connection) {
            logger.debug("[join] ignoring stale disconnect of {} from {}", player.getId(),
                    connection == null ? null : connection.getId());
            return;
        }
        leaveMap(player, true);
        player.markOffline();
        profiles.saveAsync(player);
        logger.info("[join] {} disconnected", player.getId());
    }

    // ===== shared steps =====

    /**
     * Populate the destination and register the player in it. Monsters are
     * created before registration so the newcomer gets them once, from the snapshot.
     */
    private void enterMap(Player player, String mapId) {
        spawns.ensureMonsters(mapId);
        world.addPlayerToMap(player, mapId);
    }

    /**
     * Leave the current map, tell the players left behind and evict the map's
     * monsters if it is now empty.
     * @param nearbyOnly notify only the area of interest instead of the whole map
     */
    private void leaveMap(Player player, boolean nearbyOnly) {
        String oldMap = player.getMapId();
        if (!world.removePlayerFromMap(player)) return;
        OutboundMessage left = Messages.playerLeft(player);
        if (nearbyOnly) {
            aoi.broadcastToAOI(player.getId(), player.getX(), player.getY(), oldMap, left);
        } else {
            aoi.broadcastToMap(oldMap, left);
        }
        spawns.cleanupMapIfEmpty(oldMap);
    }

    private void sendSelfState(Player player) {
        aoi.sendTo(player, Messages.xpUpdated(player));
        aoi.sendTo(player, OutboundMessage.builder(EventType.PLAYER_STATS_INITIALIZED)
                .putAll(Messages.stats(EventType.PLAYER_STATS_INITIALIZED, player).payload())
                .put("map", player.getMapId())
                .put("position", Messages.position(player.getX(), player.getY()))
                .put("bcoins", player.getBcoins())
                .build());
    }

    private void sendMapSnapshot(Player player) {
        for (Monster m : world.monstersInMap(player.getMapId())) {
            if (m.isAlive()) aoi.sendTo(player, Messages.monsterSpawn(m));
        }
        for (Map<String, Object> nearby : aoi.playersInAOI(player.getId(), player.getX(), player.getY(), player.getMapId())) {
            aoi.sendTo(player, new OutboundMessage(EventType.PLAYER_JOINED, nearby));
        }
    }

    private void announce(Player player) {
        aoi.broadcastToAOI(player.getId(), player.getX(), player.getY(), player.getMapId(), Messages.playerJoined(player));
    }

    private static String levelGateMessage(GameMap map) {
        return "You need to be level " + map.getMinLevel() + "+ to enter this map.";
    }
}
