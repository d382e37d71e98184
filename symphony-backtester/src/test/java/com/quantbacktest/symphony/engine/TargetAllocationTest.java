package com.quantbacktest.symphony.engine;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TargetAllocation normalization.
 */
class TargetAllocationTest {

    @Test
    void testNormalized_ScalesToOne() {
        // Arrange
        Map<String, Double> raw = new LinkedHashMap<>();
        raw.put("S", 2.0);
        raw.put("T", 1.0);

        // Act
        TargetAllocation allocation = TargetAllocation.normalized(raw);

        // Assert
        assertEquals(0.667, allocation.weightOf("S"), 1e-3);
        assertEquals(0.333, allocation.weightOf("T"), 1e-3);
        assertEquals(List.of("S", "T"), List.copyOf(allocation.selectedSymbols()));
    }

    @Test
    void testNormalized_DropsNonPositiveWeights() {
        // Arrange
        Map<String, Double> raw = new LinkedHashMap<>();
        raw.put("A", 0.0);
        raw.put("B", -1.0);
        raw.put("C", 3.0);

        // Act
        TargetAllocation allocation = TargetAllocation.normalized(raw);

        // Assert
        assertEquals(Map.of("C", 1.0), allocation.getWeights());
        assertFalse(allocation.contains("A"));
    }

    @Test
    void testNormalized_ZeroTotal_Cash() {
        // Act
        TargetAllocation allocation = TargetAllocation.normalized(Map.of("A", 0.0));

        // Assert
        assertTrue(allocation.isCash());
        assertEquals(0.0, allocation.totalWeight());
        assertEquals("CASH", allocation.toString());
    }

    @Test
    void testWeights_Unmodifiable() {
        // Arrange
        TargetAllocation allocation = TargetAllocation.normalized(Map.of("A", 1.0));

        // Act & Assert
        assertThrows(UnsupportedOperationException.class, () -> allocation.getWeights().put("B", 1.0));
    }
}
