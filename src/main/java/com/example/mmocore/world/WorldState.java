package com.example.mmocore.world;

import com.example.mmocore.model.Drop;
import com.example.mmocore.model.Monster;
import com.example.mmocore.model.Player;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exclusive owner of all Player, Monster and Drop records and of the
 * map membership indices.
 *
 * Invariant: a player is listed in the index of map M iff it is a member of M,
 * and then {@code player.getMapId()} is M; a monster is listed in the index of
 * its own map iff it is in the monster table. Every mutation below keeps entity
 * and index in step.
 *
 * Confined to the simulation thread, so no locking. Iteration follows
 * insertion order, which gives each tick a fixed enumeration order. Listing
 * methods return snapshots that are safe to iterate while mutating.
 */
public class WorldState {

    private final Map<String, Player> players = new LinkedHashMap<>();
    private final Map<String, Monster> monsters = new LinkedHashMap<>();
    private final Map<String, Drop> drops = new LinkedHashMap<>();

    private final Map<String, Set<String>> mapPlayers = new LinkedHashMap<>();
    private final Map<String, Set<String>> mapMonsters = new LinkedHashMap<>();
    private final Map<String, Set<String>> mapDrops = new LinkedHashMap<>();

    // ===== players =====

    /**
     * Insert or replace a player record. Membership is not touched; use
     * {@link #addPlayerToMap(Player, String)} to register the player in a map.
     */
    public void upsertPlayer(Player player) {
        Player previous = players.put(player.getId(), player);
        if (previous != null && previous != player) {
            removeFromIndex(mapPlayers, previous.getMapId(), previous.getId());
        }
    }

    public Player getPlayer(String playerId) {
        return playerId == null ? null : players.get(playerId);
    }

    public boolean hasPlayer(String playerId) {
        return playerId != null && players.containsKey(playerId);
    }

    public List<Player> allPlayers() {
        return new ArrayList<>(players.values());
    }

    /**
     * Register the player as a member of {@code mapId}, leaving any previous map.
     * The player record must already be in the store.
     */
    public void addPlayerToMap(Player player, String mapId) {
        if (players.get(player.getId()) != player) {
            throw new IllegalStateException("Player " + player.getId() + " is not registered in the world state");
        }
        String current = player.getMapId();
        if (current != null && !current.equals(mapId)) {
            removeFromIndex(mapPlayers, current, player.getId());
        }
        player.setMapId(mapId);
        mapPlayers.computeIfAbsent(mapId, k -> new LinkedHashSet<>()).add(player.getId());
    }

    /**
     * Remove the player from its current map's membership. The player keeps its
     * map id as "last known map" but is no longer a member of it.
     * @return true if the player was a member
     */
    public boolean removePlayerFromMap(Player player) {
        return removeFromIndex(mapPlayers, player.getMapId(), player.getId());
    }

    public boolean isMember(Player player) {
        Set<String> ids = mapPlayers.get(player.getMapId());
        return ids != null && ids.contains(player.getId());
    }

    public List<Player> playersInMap(String mapId) {
        Set<String> ids = mapPlayers.get(mapId);
        if (ids == null || ids.isEmpty()) return Collections.emptyList();
        List<Player> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            Player p = players.get(id);
            if (p != null) out.add(p);
        }
        return out;
    }

    public int playerCount(String mapId) {
        Set<String> ids = mapPlayers.get(mapId);
        return ids == null ? 0 : ids.size();
    }

    public boolean mapHasPlayers(String mapId) {
        return playerCount(mapId) > 0;
    }

    // ===== monsters =====

    public void upsertMonster(Monster monster) {
        Monster previous = monsters.put(monster.getId(), monster);
        if (previous != null && !previous.getMapId().equals(monster.getMapId())) {
            removeFromIndex(mapMonsters, previous.getMapId(), previous.getId());
        }
        mapMonsters.computeIfAbsent(monster.getMapId(), k -> new LinkedHashSet<>()).add(monster.getId());
    }

    public Monster getMonster(String monsterId) {
        return monsterId == null ? null : monsters.get(monsterId);
    }

    public boolean hasMonster(String monsterId) {
        return monsterId != null && monsters.containsKey(monsterId);
    }

    public Monster removeMonster(String monsterId) {
        Monster removed = monsters.remove(monsterId);
        if (removed != null) {
            removeFromIndex(mapMonsters, removed.getMapId(), monsterId);
        }
        return removed;
    }

    public List<Monster> allMonsters() {
        return new ArrayList<>(monsters.values());
    }

    public List<Monster> monstersInMap(String mapId) {
        Set<String> ids = mapMonsters.get(mapId);
        if (ids == null || ids.isEmpty()) return Collections.emptyList();
        List<Monster> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            Monster m = monsters.get(id);
            if (m != null) out.add(m);
        }
        return out;
    }

    public int monsterCount(String mapId) {
        Set<String> ids = mapMonsters.get(mapId);
        return ids == null ? 0 : ids.size();
    }

    /**
     * Discard the whole monster set of a map (and its drops).
     * @return the ids of the removed monsters
     */
    public List<String> removeMonstersInMap(String mapId) {
        Set<String> ids = mapMonsters.remove(mapId);
        List<String> removed = new ArrayList<>();
        if (ids != null) {
            for (String id : ids) {
                if (monsters.remove(id) != null) removed.add(id);
            }
        }
        Set<String> dropIds = mapDrops.remove(mapId);
        if (dropIds != null) {
            for (String id : dropIds) drops.remove(id);
        }
        return removed;
    }

    // ===== drops =====

    public void addDrop(Drop drop) {
        drops.put(drop.getId(), drop);
        mapDrops.computeIfAbsent(drop.getMapId(), k -> new LinkedHashSet<>()).add(drop.getId());
    }

    public Drop getDrop(String dropId) {
        return dropId == null ? null : drops.get(dropId);
    }

    public Drop removeDrop(String dropId) {
        Drop removed = drops.remove(dropId);
        if (removed != null) {
            removeFromIndex(mapDrops, removed.getMapId(), dropId);
        }
        return removed;
    }

    public List<Drop> dropsInMap(String mapId) {
        Set<String> ids = mapDrops.get(mapId);
        if (ids == null) return Collections.emptyList();
        List<Drop> out = new ArrayList<>();
        for (String id : ids) {
            Drop d = drops.get(id);
            if (d != null) out.add(d);
        }
        return out;
    }

    private static boolean removeFromIndex(Map<String, Set<String>> index, String mapId, String id) {
        if (mapId == null) return false;
        Set<String> ids = index.get(mapId);
        if (ids == null) return false;
        boolean removed = ids.remove(id);
        if (ids.isEmpty()) index.remove(mapId);
        return removed;
    }
}
