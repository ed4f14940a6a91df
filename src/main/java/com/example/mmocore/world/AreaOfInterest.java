package com.example.mmocore.world;

import com.example.mmocore.model.Player;
import com.example.mmocore.net.Connection;
import com.example.mmocore.net.Messages;
import com.example.mmocore.net.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Area-of-interest fan-out: decides which connected clients receive an event.
 *
 * Distance checks are brute force over the members of one map. Players
 * without an active connection are skipped silently.
 */
public class AreaOfInterest {
    private static final Logger logger = LoggerFactory.getLogger(AreaOfInterest.class);

    private final WorldState world;
    private final double radius;

    public AreaOfInterest(WorldState world, double radius) {
        this.world = world;
        this.radius = radius;
    }

    public double getRadius() {
        return radius;
    }

    /**
     * Deliver to every connected member of {@code mapId} within the radius of (x, y).
     * @param originId player to exclude, or null to include everyone
     * @return number of recipients
     */
    public int broadcastToAOI(String originId, double x, double y, String mapId, OutboundMessage message) {
        int sent = 0;
        for (Player p : world.playersInMap(mapId)) {
            if (originId != null && originId.equals(p.getId())) continue;
            if (distance(x, y, p.getX(), p.getY()) > radius) continue;
            if (deliver(p, message)) sent++;
        }
        return sent;
    }

    /**
     * Deliver to every connected member of {@code mapId} regardless of distance.
     * @return number of recipients
     */
    public int broadcastToMap(String mapId, OutboundMessage message) {
        int sent = 0;
        for (Player p : world.playersInMap(mapId)) {
            if (deliver(p, message)) sent++;
        }
        return sent;
    }

    /**
     * Deliver to every connected player in the world.
     */
    public int broadcastAll(OutboundMessage message) {
        int sent = 0;
        for (Player p : world.allPlayers()) {
            if (deliver(p, message)) sent++;
        }
        return sent;
    }

    /**
     * Deliver to a single player.
     * @return false if the player is offline
     */
    public boolean sendTo(Player player, OutboundMessage message) {
        return player != null && deliver(player, message);
    }

    /**
     * Snapshot of the members near (x, y), as {@code player:joined} payloads.
     * Read-only; membership is not affected.
     */
    public List<Map<String, Object>> playersInAOI(String originId, double x, double y, String mapId) {
        List<Map<String, Object>> nearby = new ArrayList<>();
        for (Player p : world.playersInMap(mapId)) {
            if (originId != null && originId.equals(p.getId())) continue;
            if (distance(x, y, p.getX(), p.getY()) <= radius) {
                nearby.add(Messages.joinedPayload(p));
            }
        }
        return nearby;
    }

    public static double distance(double x1, double y1, double x2, double y2) {
        return Math.hypot(x2 - x1, y2 - y1);
    }

    private static boolean deliver(Player p, OutboundMessage message) {
        Connection c = p.getConnection();
        if (c == null) return false;
        try {
            c.send(message);
            return true;
        } catch (RuntimeException e) {
            logger.warn("[aoi] send of {} to {} failed: {}", message.wireName(), p.getId(), e.getMessage());
            return false;
        }
    }
}
