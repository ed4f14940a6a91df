package com.example.mmocore.world;

import com.example.mmocore.event.SpawnConfig;
import com.example.mmocore.model.CharacterClass;
import com.example.mmocore.model.GameMap;
import com.example.mmocore.model.MonsterTemplate;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only static data: maps, class table, monster templates and per-map
 * spawn configuration.
 */
public class WorldDefinition {

    private final Map<String, GameMap> maps;
    private final Map<String, CharacterClass> classes;
    private final String defaultClassKey;
    private final Map<String, MonsterTemplate> monsters;
    private final Map<String, SpawnConfig> spawns;

    public WorldDefinition(Map<String, GameMap> maps,
                           Map<String, CharacterClass> classes,
                           String defaultClassKey,
                           Map<String, MonsterTemplate> monsters,
                           Map<String, SpawnConfig> spawns) {
        this.maps = Collections.unmodifiableMap(new LinkedHashMap<>(maps));
        this.classes = Collections.unmodifiableMap(new LinkedHashMap<>(classes));
        this.monsters = Collections.unmodifiableMap(new LinkedHashMap<>(monsters));
        this.spawns = Collections.unmodifiableMap(new LinkedHashMap<>(spawns));
        if (!this.classes.containsKey(defaultClassKey)) {
            throw new IllegalStateException("Default class '" + defaultClassKey + "' is not defined");
        }
        this.defaultClassKey = defaultClassKey;
        for (SpawnConfig spawn : this.spawns.values()) {
            for (String type : spawn.types) {
                if (!this.monsters.containsKey(type)) {
                    throw new IllegalStateException("Spawn for map '" + spawn.mapId + "' references unknown monster '" + type + "'");
                }
            }
        }
    }

    public GameMap getMap(String mapId) {
        return mapId == null ? null : maps.get(mapId);
    }

    public Collection<GameMap> getMaps() {
        return maps.values();
    }

    /**
     * Class table lookup; unknown classes fall back to the default class.
     */
    public CharacterClass getCharacterClass(String classKey) {
        CharacterClass cls = classKey == null ? null : classes.get(classKey.toLowerCase());
        return cls != null ? cls : classes.get(defaultClassKey);
    }

    public MonsterTemplate getMonsterTemplate(String type) {
        return monsters.get(type);
    }

    public SpawnConfig getSpawnConfig(String mapId) {
        return mapId == null ? null : spawns.get(mapId);
    }
}
