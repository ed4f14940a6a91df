package com.example.mmocore.net;

import java.util.Collections;
import java.util.Map;

/**
 * Tolerant read access to an inbound payload. Every getter returns null
 * (never throws) when the key is missing or has the wrong shape.
 */
public class Payload {

    private final Map<String, Object> values;

    public Payload(Map<String, Object> values) {
        this.values = values == null ? Collections.emptyMap() : values;
    }

    public Object raw(String key) {
        return values.get(key);
    }

    public String getString(String key) {
        Object v = values.get(key);
        if (v == null) return null;
        String s = v.toString();
        return s.isEmpty() ? null : s;
    }

    /**
     * Whole-number read, rounded. Values outside the {@code int} range read as absent.
     */
    public Integer getInt(String key) {
        Double d = getDouble(key);
        if (d == null) return null;
        long rounded = Math.round(d);
        if (rounded < Integer.MIN_VALUE || rounded > Integer.MAX_VALUE) return null;
        return (int) rounded;
    }

    public Double getDouble(String key) {
        Object v = values.get(key);
        Double d = null;
        if (v instanceof Number n) {
            d = n.doubleValue();
        } else if (v instanceof String s) {
            try {
                d = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (d == null || Double.isNaN(d) || Double.isInfinite(d)) return null;
        return d;
    }

    @SuppressWarnings("unchecked")
    public Payload getObject(String key) {
        Object v = values.get(key);
        return v instanceof Map ? new Payload((Map<String, Object>) v) : null;
    }

    /**
     * Read a {@code {x, y}} object.
     * @return a two-element array, or null if either coordinate is missing
     */
    public double[] getPosition(String key) {
        Payload pos = getObject(key);
        if (pos == null) return null;
        Double x = pos.getDouble("x");
        Double y = pos.getDouble("y");
        if (x == null || y == null) return null;
        return new double[] {x, y};
    }
}
