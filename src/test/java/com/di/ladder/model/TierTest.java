package com.di.ladder.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Tier Tests")
class TierTest {

    @Test
    @DisplayName("Should order tiers from bronze to champion")
    void testLadderOrder() {
        assertEquals(Tier.BRONZE, Tier.values()[0]);
        assertEquals(Tier.CHAMPION, Tier.values()[Tier.values().length - 1]);
        assertEquals(Optional.of(Tier.SILVER), Tier.BRONZE.successor());
        assertEquals(Optional.of(Tier.DIAMOND), Tier.CHAMPION.predecessor());
    }

    @Test
    @DisplayName("Should have no successor above top and no predecessor below bottom")
    void testBoundaries() {
        assertTrue(Tier.CHAMPION.isTop());
        assertTrue(Tier.CHAMPION.successor().isEmpty());
        assertTrue(Tier.BRONZE.isBottom());
        assertTrue(Tier.BRONZE.predecessor().isEmpty());
        assertFalse(Tier.GOLD.isTop());
        assertFalse(Tier.GOLD.isBottom());
    }

    @Test
    @DisplayName("Should parse keys case-insensitively")
    void testFromKey() {
        assertEquals(Tier.PLATINUM, Tier.fromKey("platinum"));
        assertEquals(Tier.PLATINUM, Tier.fromKey(" Platinum "));
        assertEquals("platinum", Tier.PLATINUM.key());
    }

    @Test
    @DisplayName("Should reject unknown and blank keys")
    void testFromKey_Invalid() {
        assertThrows(IllegalArgumentException.class, () -> Tier.fromKey("mithril"));
        assertThrows(IllegalArgumentException.class, () -> Tier.fromKey(""));
        assertThrows(IllegalArgumentException.class, () -> Tier.fromKey(null));
    }
}
