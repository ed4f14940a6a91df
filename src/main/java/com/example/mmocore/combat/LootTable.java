package com.example.mmocore.combat;

import com.example.mmocore.model.Drop;
import com.example.mmocore.model.Monster;
import com.example.mmocore.model.MonsterTemplate;

import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Kill rewards: one loot item from the monster's table, a bcoins amount and
 * the floating drop left where the monster died.
 */
public class LootTable {

    private final Random random;
    private final int bcoinsMin;
    private final int bcoinsMax;
    private final double bcoinsDropChance;
    private final AtomicLong dropSequence = new AtomicLong();

    /**
     * @param random source of randomness (scripted in tests)
     * @param bcoinsMin inclusive lower bound of the bcoins award
     * @param bcoinsMax inclusive upper bound of the bcoins award
     * @param bcoinsDropChance probability that the floating drop shows bcoins rather than the item
     */
    public LootTable(Random random, int bcoinsMin, int bcoinsMax, double bcoinsDropChance) {
        this.random = random;
        this.bcoinsMin = bcoinsMin;
        this.bcoinsMax = bcoinsMax;
        this.bcoinsDropChance = bcoinsDropChance;
    }

    /**
     * Pick one loot item uniformly.
     * @return the item id, or null if the template has no loot
     */
    public String rollItem(MonsterTemplate template) {
        List<String> loot = template.getLoot();
        if (loot.isEmpty()) return null;
        return loot.get(random.nextInt(loot.size()));
    }

    public int rollBcoins() {
        return bcoinsMin + random.nextInt(bcoinsMax - bcoinsMin + 1);
    }

    /**
     * Build the floating drop at the monster's position.
     */
    public Drop createDrop(Monster monster, int bcoins, String itemName) {
        Drop.Kind kind = random.nextDouble() < bcoinsDropChance || itemName == null
                ? Drop.Kind.BCOINS
                : Drop.Kind.ITEM;
        String id = "drop_" + monster.getMapId() + "_" + dropSequence.incrementAndGet();
        return new Drop(id, monster.getMapId(), monster.getX(), monster.getY(), kind, bcoins, itemName);
    }
}
