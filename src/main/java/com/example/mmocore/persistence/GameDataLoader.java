package com.example.mmocore.persistence;

import com.example.mmocore.event.SpawnConfig;
import com.example.mmocore.model.CharacterClass;
import com.example.mmocore.model.GameMap;
import com.example.mmocore.model.MonsterTemplate;
import com.example.mmocore.world.WorldDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads static world data (maps, classes, monsters, spawns) from a YAML resource.
 */
public class GameDataLoader {
    private static final Logger logger = LoggerFactory.getLogger(GameDataLoader.class);

    public static final String DEFAULT_RESOURCE = "/data/world.yaml";

    private GameDataLoader() {}

    public static WorldDefinition loadFromResource(String resourcePath) {
        try (InputStream is = GameDataLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IllegalStateException("World data resource not found: " + resourcePath);
            }
            Map<String, Object> data = new Yaml().load(is);
            WorldDefinition world = fromMap(data);
            logger.info("[data] loaded world data from {}", resourcePath);
            return world;
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load world data " + resourcePath, e);
        }
    }

    @SuppressWarnings("unchecked")
    public static WorldDefinition fromMap(Map<String, Object> data) {
        if (data == null) throw new IllegalStateException("World data is empty");

        Map<String, GameMap> maps = new LinkedHashMap<>();
        Map<String, Object> mapsNode = (Map<String, Object>) data.getOrDefault("maps", Map.of());
        for (Map.Entry<String, Object> e : mapsNode.entrySet()) {
            Map<String, Object> m = (Map<String, Object>) e.getValue();
            Object minLevel = m.get("minLevel");
            maps.put(e.getKey(), new GameMap(
                    e.getKey(),
                    parseDoubleSafe(m.get("spawnX")),
                    parseDoubleSafe(m.get("spawnY")),
                    parseBool(m.get("safeZone")),
                    parseBool(m.get("pvp")),
                    minLevel == null ? null : parseIntSafe(minLevel)));
        }

        Map<String, CharacterClass> classes = new LinkedHashMap<>();
        Map<String, Object> classesNode = (Map<String, Object>) data.getOrDefault("classes", Map.of());
        for (Map.Entry<String, Object> e : classesNode.entrySet()) {
            Map<String, Object> c = (Map<String, Object>) e.getValue();
            String key = e.getKey().toLowerCase();
            classes.put(key, new CharacterClass(key,
                    parseIntSafe(c.get("baseHp")),
                    parseIntSafe(c.get("hpPerLevel")),
                    parseIntSafe(c.get("baseAttack")),
                    parseIntSafe(c.get("attackPerLevel"))));
        }
        String defaultClass = str(data.get("defaultClass"));
        if (defaultClass == null && !classes.isEmpty()) defaultClass = classes.keySet().iterator().next();

        Map<String, MonsterTemplate> monsters = new LinkedHashMap<>();
        Map<String, Object> monstersNode = (Map<String, Object>) data.getOrDefault("monsters", Map.of());
        for (Map.Entry<String, Object> e : monstersNode.entrySet()) {
            Map<String, Object> m = (Map<String, Object>) e.getValue();
            monsters.put(e.getKey(), new MonsterTemplate(e.getKey(),
                    parseIntSafe(m.get("hp")),
                    parseIntSafe(m.get("attack")),
                    parseDoubleSafe(m.get("speed")),
                    parseDoubleSafe(m.get("aggro")),
                    parseDoubleSafe(m.get("attackRange")),
                    parseIntSafe(m.get("cooldown")),
                    parseIntSafe(m.get("xp")),
                    strList(m.get("loot"))));
        }

        Map<String, SpawnConfig> spawns = new LinkedHashMap<>();
        Map<String, Object> spawnsNode = (Map<String, Object>) data.getOrDefault("spawns", Map.of());
        for (Map.Entry<String, Object> e : spawnsNode.entrySet()) {
            Map<String, Object> s = (Map<String, Object>) e.getValue();
            Map<String, Object> bounds = (Map<String, Object>) s.getOrDefault("bounds", Map.of());
            spawns.put(e.getKey(), new SpawnConfig(e.getKey(),
                    parseIntSafe(s.get("count")),
                    strList(s.get("types")),
                    parseDoubleSafe(bounds.get("minX")),
                    parseDoubleSafe(bounds.get("maxX")),
                    parseDoubleSafe(bounds.get("minY")),
                    parseDoubleSafe(bounds.get("maxY"))));
        }

        logger.info("[data] {} maps, {} classes, {} monster types, {} spawn tables",
                maps.size(), classes.size(), monsters.size(), spawns.size());
        return new WorldDefinition(maps, classes, defaultClass, monsters, spawns);
    }

    // ===== tolerant value helpers =====

    private static int parseIntSafe(Object val) {
        if (val == null) return 0;
        if (val instanceof Number) return ((Number) val).intValue();
        try {
            return Integer.parseInt(val.toString().trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static double parseDoubleSafe(Object val) {
        if (val == null) return 0;
        if (val instanceof Number) return ((Number) val).doubleValue();
        try {
            return Double.parseDouble(val.toString().trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static boolean parseBool(Object val) {
        if (val instanceof Boolean) return (Boolean) val;
        return val != null && Boolean.parseBoolean(val.toString().trim());
    }

    private static String str(Object val) {
        return val == null ? null : val.toString();
    }

    private static List<String> strList(Object val) {
        List<String> out = new ArrayList<>();
        if (val instanceof List<?> list) {
            for (Object o : list) {
                if (o != null) out.add(o.toString());
            }
        }
        return out;
    }
}
