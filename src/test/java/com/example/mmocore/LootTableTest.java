package com.example.mmocore;

import com.example.mmocore.combat.LootTable;
import com.example.mmocore.model.Drop;
import com.example.mmocore.model.Monster;
import com.example.mmocore.model.MonsterTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LootTable Tests")
class LootTableTest {

    private static final MonsterTemplate CHONCHON =
            new MonsterTemplate("chonchon", 55, 7, 2.2, 200, 60, 1200, 10, List.of("potion", "coin", "gem"));
    private static final MonsterTemplate EMPTY =
            new MonsterTemplate("dummy", 1, 0, 0, 0, 0, 1000, 0, List.of());

    private ScriptedRandom random;
    private LootTable loot;

    @BeforeEach
    void setUp() {
        random = new ScriptedRandom();
        loot = new LootTable(random, 10, 30, 0.7);
    }

    @Test
    @DisplayName("Bcoins award spans the inclusive range")
    void bcoinsRange() {
        random.queueInts(0, 20, 21);
        assertEquals(10, loot.rollBcoins());
        assertEquals(30, loot.rollBcoins());
        assertEquals(10, loot.rollBcoins());   // bound is 21
    }

    @Test
    @DisplayName("Item is picked from the template's table")
    void rollItem() {
        random.queueInts(2, 1);
        assertEquals("gem", loot.rollItem(CHONCHON));
        assertEquals("coin", loot.rollItem(CHONCHON));
        assertNull(loot.rollItem(EMPTY));
    }

    @Test
    @DisplayName("Drop kind follows the bcoins roll")
    void dropKind() {
        Monster m = new Monster("monster_field_1_chonchon_1", CHONCHON, "monster_field_1", 10, 20, 0);
        random.queueDoubles(0.69, 0.7);

        Drop coins = loot.createDrop(m, 15, "gem");
        Drop item = loot.createDrop(m, 15, "gem");

        assertEquals(Drop.Kind.BCOINS, coins.getKind());
        assertEquals(Drop.Kind.ITEM, item.getKind());
        assertEquals("drop_monster_field_1_1", coins.getId());
        assertEquals("drop_monster_field_1_2", item.getId());
        assertEquals(10, item.getX(), 0.0001);
        assertEquals(20, item.getY(), 0.0001);
    }

    @Test
    @DisplayName("Missing item always drops bcoins")
    void noItemMeansBcoins() {
        Monster m = new Monster("m", EMPTY, "f", 0, 0, 0);
        random.queueDoubles(0.99);
        assertEquals(Drop.Kind.BCOINS, loot.createDrop(m, 12, null).getKind());
    }
}
