package com.example.mmocore;

import com.example.mmocore.model.EquipmentSlot;
import com.example.mmocore.model.Player;
import com.example.mmocore.net.EventType;
import com.example.mmocore.net.OutboundMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PlayerStatsService Tests")
class PlayerStatsServiceTest {

    private GameFixture game;
    private GameFixture.Client a;

    @BeforeEach
    void setUp() {
        game = new GameFixture();
        a = game.join("a@test", "town_1", 1200, 900);
        a.connection.clear();
    }

    @Test
    @DisplayName("Equipping recomputes stats and reports extras")
    void equip() {
        game.services.playerStats.equip(a.player(), EquipmentSlot.WEAPON, Map.of("attack", 10.0, "crit", 0.2));

        OutboundMessage updated = a.connection.last(EventType.PLAYER_STATS_UPDATED);
        assertEquals(25.0, updated.get("attack"));
        assertEquals(25, a.player().getAttack(), 0.0001);
        assertEquals(0.2, a.player().getExtraStats().get("crit"), 0.0001);
    }

    @Test
    @DisplayName("Equipment HP bonus keeps the HP ratio")
    void equipKeepsRatio() {
        Player p = a.player();
        p.takeDamage(60);

        game.services.playerStats.equip(p, EquipmentSlot.BODY, Map.of("maxHp", 120.0));

        assertEquals(240, p.getMaxHp());
        assertEquals(120, p.getHp());
    }

    @Test
    @DisplayName("Unequipping an empty slot does nothing")
    void unequipEmpty() {
        assertFalse(game.services.playerStats.unequip(a.player(), EquipmentSlot.HEAD));
        assertTrue(a.connection.all().isEmpty());
    }

    @Test
    @DisplayName("Unequipping restores the base stats")
    void unequip() {
        game.services.playerStats.equip(a.player(), EquipmentSlot.BOOTS, Map.of("speed", 0.5));
        assertTrue(game.services.playerStats.unequip(a.player(), EquipmentSlot.BOOTS));
        assertEquals(1.0, a.player().getSpeed(), 0.0001);
        assertEquals(2, a.connection.count(EventType.PLAYER_STATS_UPDATED));
    }
}
