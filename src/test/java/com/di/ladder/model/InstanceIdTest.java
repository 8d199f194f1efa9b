package com.di.ladder.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InstanceId Tests")
class InstanceIdTest {

    @Test
    @DisplayName("Should render as tier key and number")
    void testToString() {
        assertEquals("gold_3", InstanceId.of(Tier.GOLD, 3).toString());
    }

    @Test
    @DisplayName("Should reject instance numbers below 1 and a missing tier")
    void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> InstanceId.of(Tier.GOLD, 0));
        assertThrows(IllegalArgumentException.class, () -> InstanceId.of(Tier.GOLD, -4));
        assertThrows(IllegalArgumentException.class, () -> InstanceId.of(null, 1));
    }

    @Test
    @DisplayName("Should report full and over capacity from occupancy")
    void testOccupancyFlags() {
        InstanceOccupancy atCapacity = new InstanceOccupancy(Tier.SILVER, 2, 100, 100);
        InstanceOccupancy over = new InstanceOccupancy(Tier.SILVER, 3, 101, 100);
        InstanceOccupancy room = new InstanceOccupancy(Tier.SILVER, 4, 99, 100);

        assertTrue(atCapacity.isFull());
        assertFalse(atCapacity.isOverCapacity());
        assertTrue(over.isOverCapacity());
        assertFalse(room.isFull());
        assertEquals("silver_2", atCapacity.getInstanceId().toString());
    }
}
