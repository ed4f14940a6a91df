package com.example.mmocore;

import com.example.mmocore.net.EventType;
import com.example.mmocore.net.OutboundMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StateSyncService Tests")
class StateSyncServiceTest {

    private GameFixture game;

    @BeforeEach
    void setUp() {
        game = new GameFixture();
    }

    @Test
    @DisplayName("Player positions go to nearby players only")
    void playerSync() {
        GameFixture.Client a = game.join("a@test", "town_1", 1000, 900);
        GameFixture.Client b = game.join("b@test", "town_1", 1100, 900);
        GameFixture.Client far = game.join("far@test", "town_1", 3000, 900);
        a.connection.clear();
        b.connection.clear();
        far.connection.clear();

        game.services.sync.syncPlayers();

        OutboundMessage moved = a.connection.last(EventType.PLAYER_MOVED);
        assertEquals("b@test", moved.get("email"));
        assertEquals(Map.of("x", 1100.0, "y", 900.0), moved.get("position"));
        assertEquals(GameFixture.START, moved.get("timestamp"));
        assertEquals(1, a.connection.count(EventType.PLAYER_MOVED));
        assertEquals(1, b.connection.count(EventType.PLAYER_MOVED));
        assertEquals(0, far.connection.count(EventType.PLAYER_MOVED));
    }

    @Test
    @DisplayName("Disconnected players are not replicated")
    void offlineNotReplicated() {
        GameFixture.Client a = game.join("a@test", "town_1", 1000, 900);
        GameFixture.Client b = game.join("b@test", "town_1", 1100, 900);
        b.disconnect();
        a.connection.clear();

        game.services.sync.syncPlayers();

        assertEquals(0, a.connection.count(EventType.PLAYER_MOVED));
    }

    @Test
    @DisplayName("Live monsters are replicated to maps with players")
    void monsterSync() {
        GameFixture.Client a = game.join("a@test", "monster_field_1", 400, 400);
        a.send("monster:hit", GameFixture.payload("monsterId", "monster_field_1_poring_1", "damage", 100));
        a.connection.clear();

        game.services.sync.syncMonsters();

        assertEquals(19, a.connection.count(EventType.MONSTER_UPDATE));
        OutboundMessage update = a.connection.last(EventType.MONSTER_UPDATE);
        assertEquals("monster_field_1", update.get("mapId"));
        assertEquals(50, update.get("maxHp"));
    }

    @Test
    @DisplayName("Sync ticks run on their own periods")
    void periodicSync() {
        GameFixture.Client a = game.join("a@test", "monster_field_1", 400, 400);
        game.join("b@test", "monster_field_1", 410, 400);
        game.services.sync.initialize();
        a.connection.clear();

        game.scheduler.advance(50);
        assertEquals(1, a.connection.count(EventType.PLAYER_MOVED));
        assertEquals(0, a.connection.count(EventType.MONSTER_UPDATE));

        game.scheduler.advance(50);
        assertEquals(2, a.connection.count(EventType.PLAYER_MOVED));
        assertEquals(20, a.connection.count(EventType.MONSTER_UPDATE));
    }
}
