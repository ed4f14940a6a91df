package com.example.mmocore;

import com.example.mmocore.model.Attribute;
import com.example.mmocore.model.ChatChannel;
import com.example.mmocore.model.Direction;
import com.example.mmocore.model.PlayerState;
import com.example.mmocore.net.InboundEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Model enum Tests")
class ModelEnumsTest {

    // ==================== Direction Tests ====================

    @ParameterizedTest
    @CsvSource({
        "0, RIGHT",
        "180, LEFT",
        "90, FRONT",
        "-90, BACK",
        "30, RIGHT",
        "60, FRONT",
        "120, FRONT",
        "135.5, LEFT",
        "-150, LEFT"
    })
    @DisplayName("Angles quantize to the dominant axis")
    void directionFromAngle(double degrees, Direction expected) {
        assertEquals(expected, Direction.fromAngle(Math.toRadians(degrees)));
    }

    @Test
    @DisplayName("Direction keys parse case-insensitively")
    void directionFromKey() {
        assertEquals(Direction.LEFT, Direction.fromKey("Left"));
        assertNull(Direction.fromKey("up"));
        assertNull(Direction.fromKey(null));
    }

    // ==================== Attribute Tests ====================

    @ParameterizedTest
    @EnumSource(Attribute.class)
    @DisplayName("Attributes parse from their names in any case")
    void attributeFromKey(Attribute attribute) {
        assertEquals(attribute, Attribute.fromKey(attribute.name()));
        assertEquals(attribute, Attribute.fromKey(attribute.name().toLowerCase()));
    }

    @Test
    @DisplayName("Unknown attributes are null")
    void attributeUnknown() {
        assertNull(Attribute.fromKey("CHARM"));
        assertNull(Attribute.fromKey(""));
        assertNull(Attribute.fromKey(null));
    }

    // ==================== Channel and State Tests ====================

    @ParameterizedTest
    @EnumSource(ChatChannel.class)
    @DisplayName("Chat channels round-trip through their keys")
    void chatChannelKeys(ChatChannel channel) {
        assertSame(channel, ChatChannel.fromKey(channel.getKey()));
    }

    @Test
    @DisplayName("Player states parse from wire keys")
    void playerStates() {
        assertEquals(PlayerState.MOVING, PlayerState.fromKey("moving"));
        assertNull(PlayerState.fromKey("flying"));
    }

    @ParameterizedTest
    @EnumSource(InboundEvent.class)
    @DisplayName("Inbound events resolve from their wire names")
    void inboundEvents(InboundEvent event) {
        assertSame(event, InboundEvent.fromWireName(event.getWireName()));
    }
}
