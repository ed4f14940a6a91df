package com.example.mmocore.model;

/**
 * A floating loot entity left in a map after a kill, waiting to be picked up.
 */
public class Drop {

    public enum Kind {
        BCOINS("bcoins"),
        ITEM("item");

        private final String key;

        Kind(String key) { this.key = key; }

        public String getKey() { return key; }
    }

    private final String id;
    private final String mapId;
    private final double x;
    private final double y;
    private final Kind kind;
    private final int amount;
    private final String itemName;

    public Drop(String id, String mapId, double x, double y, Kind kind, int amount, String itemName) {
        this.id = id;
        this.mapId = mapId;
        this.x = x;
        this.y = y;
        this.kind = kind;
        this.amount = amount;
        this.itemName = itemName;
    }

    public String getId() { return id; }
    public String getMapId() { return mapId; }
    public double getX() { return x; }
    public double getY() { return y; }
    public Kind getKind() { return kind; }
    public int getAmount() { return amount; }
    public String getItemName() { return itemName; }
}
