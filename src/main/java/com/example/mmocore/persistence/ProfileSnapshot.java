package com.example.mmocore.persistence;

import com.example.mmocore.model.Attribute;
import com.example.mmocore.model.Player;

/**
 * Immutable copy of the profile fields written on disconnect. Taken on the
 * simulation thread so the writer never reads a live Player.
 */
public record ProfileSnapshot(
        String playerId,
        int str,
        int agi,
        int vit,
        int intel,
        int dex,
        int luck,
        int statPoints
) {
    public static ProfileSnapshot of(Player player) {
        return new ProfileSnapshot(
                player.getId(),
                player.getAttribute(Attribute.STR),
                player.getAttribute(Attribute.AGI),
                player.getAttribute(Attribute.VIT),
                player.getAttribute(Attribute.INT),
                player.getAttribute(Attribute.DEX),
                player.getAttribute(Attribute.LUCK),
                player.getStatPoints());
    }
}
