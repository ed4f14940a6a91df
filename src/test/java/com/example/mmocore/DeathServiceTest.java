package com.example.mmocore;

import com.example.mmocore.lifecycle.DeathService;
import com.example.mmocore.model.Player;
import com.example.mmocore.model.PlayerState;
import com.example.mmocore.net.EventType;
import com.example.mmocore.net.OutboundMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Death and revive Tests")
class DeathServiceTest {

    private GameFixture game;

    @BeforeEach
    void setUp() {
        game = new GameFixture();
    }

    // ==================== PvE ====================

    @Test
    @DisplayName("PvE death sends the player to town at once")
    void pveDeathRelocates() {
        GameFixture.Client a = game.join("a@test", "monster_field_1", 400, 400);
        GameFixture.Client b = game.join("b@test", "monster_field_1", 420, 400);
        b.connection.clear();

        game.services.combat.damagePlayer(a.player(), 1000, "monster_field_1_poring_1");

        Player p = a.player();
        assertTrue(p.isDead());
        assertEquals(PlayerState.DEAD, p.getState());
        assertEquals(0, p.getHp());
        assertEquals("town_1", p.getMapId());
        assertEquals(1200, p.getX(), 0.0001);
        assertEquals(900, p.getY(), 0.0001);
        assertTrue(game.services.world.playersInMap("town_1").contains(p));
        assertFalse(game.services.world.playersInMap("monster_field_1").contains(p));

        OutboundMessage died = a.connection.last(EventType.PLAYER_DIED);
        assertEquals("town_1", died.get("map"));
        assertEquals(1200.0, died.get("x"));
        assertEquals("a@test", b.connection.last(EventType.PLAYER_LEFT).get("email"));
        assertTrue(game.scheduler.isScheduled(DeathService.reviveKey("a@test")));
    }

    @Test
    @DisplayName("Last player dying in a field empties its monsters")
    void pveDeathCleansUpField() {
        GameFixture.Client a = game.join("a@test", "monster_field_1", 400, 400);
        assertEquals(20, game.services.world.monsterCount("monster_field_1"));

        game.services.combat.damagePlayer(a.player(), 1000, "m");

        assertEquals(0, game.services.world.monsterCount("monster_field_1"));
    }

    @Test
    @DisplayName("Player revives with full HP after 3 seconds")
    void pveRevive() {
        GameFixture.Client a = game.join("a@test", "monster_field_1", 400, 400);
        game.services.combat.damagePlayer(a.player(), 1000, "m");

        game.scheduler.advance(2999);
        assertTrue(a.player().isDead());

        game.scheduler.advance(1);
        Player p = a.player();
        assertFalse(p.isDead());
        assertEquals(PlayerState.IDLE, p.getState());
        assertEquals(p.getMaxHp(), p.getHp());

        OutboundMessage revived = a.connection.last(EventType.PLAYER_REVIVED);
        assertEquals(120, revived.get("hp"));
        assertEquals(120, revived.get("maxHp"));
        assertNull(revived.get("x"));
    }

    @Test
    @DisplayName("Death in town keeps the player in town")
    void pveDeathInTown() {
        GameFixture.Client a = game.join("a@test", "town_1", 1000, 800);
        GameFixture.Client b = game.join("b@test", "town_1", 1010, 800);
        b.connection.clear();

        game.services.combat.damagePlayer(a.player(), 1000, "m");

        assertEquals("town_1", a.player().getMapId());
        assertEquals(1200, a.player().getX(), 0.0001);
        assertEquals(0, b.connection.count(EventType.PLAYER_LEFT));
    }

    @Test
    @DisplayName("Dead player ignores movement, combat and map changes")
    void deadPlayerIsInert() {
        GameFixture.Client a = game.join("a@test", "monster_field_1", 400, 400);
        game.services.combat.damagePlayer(a.player(), 1000, "m");
        a.connection.clear();

        a.send("player:move", GameFixture.payload("position", GameFixture.position(10, 10), "direction", "left"));
        a.send("player:changeMap", GameFixture.payload("map", "monster_field_1"));
        a.send("player:attack", GameFixture.payload("damage", 5));

        assertEquals(1200, a.player().getX(), 0.0001);
        assertEquals("town_1", a.player().getMapId());
        assertTrue(a.connection.all().isEmpty());
    }

    // ==================== PvP ====================

    @Test
    @DisplayName("PvP death keeps the player in the arena and revives at its spawn")
    void pvpDeathAndRevive() {
        GameFixture.Client a = game.join("a@test", "pvp_arena", 900, 900, 10);
        Player p = a.player();

        game.services.combat.damagePlayer(p, 10_000, "b@test");

        assertTrue(p.isDead());
        assertEquals("pvp_arena", p.getMapId());
        assertEquals(900, p.getX(), 0.0001);
        assertEquals(0, a.connection.count(EventType.PLAYER_DIED));

        game.scheduler.advance(3000);
        assertFalse(p.isDead());
        assertEquals(p.getMaxHp(), p.getHp());
        assertEquals(500, p.getX(), 0.0001);
        assertEquals(500, p.getY(), 0.0001);
        OutboundMessage revived = a.connection.last(EventType.PLAYER_REVIVED);
        assertEquals(500.0, revived.get("x"));
        assertEquals(500.0, revived.get("y"));
    }

    @Test
    @DisplayName("Client-reported lethal hit in the arena uses the PvP death path")
    void reportedPvpKill() {
        GameFixture.Client a = game.join("a@test", "pvp_arena", 600, 600, 10);
        game.join("b@test", "pvp_arena", 610, 600, 10);

        a.send("player:hit", GameFixture.payload("damage", 10_000, "attackerEmail", "b@test"));

        assertTrue(a.player().isDead());
        assertEquals("pvp_arena", a.player().getMapId());
    }

    @Test
    @DisplayName("Repeated lethal damage triggers one death")
    void deathRunsOnce() {
        GameFixture.Client a = game.join("a@test", "monster_field_1", 400, 400);
        game.services.combat.damagePlayer(a.player(), 1000, "m");
        game.services.combat.damagePlayer(a.player(), 1000, "m");
        game.services.deaths.onDeath(a.player());

        assertEquals(1, a.connection.count(EventType.PLAYER_DIED));
    }
}
