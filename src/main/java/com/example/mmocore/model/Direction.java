package com.example.mmocore.model;

/**
 * Facing direction of a player or monster, quantized to the four cardinal
 * sprites the client knows how to draw.
 */
public enum Direction {
    FRONT("front"),
    BACK("back"),
    LEFT("left"),
    RIGHT("right");

    private final String key;

    Direction(String key) {
        this.key = key;
    }

    public String getKey() { return key; }

    /**
     * Quantize a movement vector to a facing direction.
     * Horizontal wins when |cos| > |sin|, otherwise the sign of sin picks
     * front (positive y, towards the viewer) or back.
     */
    public static Direction fromAngle(double angle) {
        double cos = Math.cos(angle);
        double sin = Math.sin(angle);
        if (Math.abs(cos) > Math.abs(sin)) {
            return cos > 0 ? RIGHT : LEFT;
        }
        return sin > 0 ? FRONT : BACK;
    }

    /**
     * Parse a direction from its wire key, case-insensitive.
     * @return the direction, or null if the key is unknown
     */
    public static Direction fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        for (Direction d : values()) {
            if (d.key.equals(k)) return d;
        }
        return null;
    }
}
