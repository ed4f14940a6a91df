package com.example.mmocore.lifecycle;

/**
 * Parsed {@code player:join} payload. Position and map are only used on the
 * first join; a reconnecting player resumes where the server last had them.
 */
public record JoinRequest(
        String playerId,
        String name,
        String classKey,
        int level,
        int xp,
        String mapId,
        double x,
        double y
) {
}
