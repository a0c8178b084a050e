package com.ttennebkram.texturefix.mask;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MaskBuilderRegistryTest {

    @Test
    void builtInPoliciesAreRegistered() {
        assertTrue(MaskBuilderRegistry.getRegisteredPolicies().contains("peaks"));
        assertTrue(MaskBuilderRegistry.getRegisteredPolicies().contains("lines"));
        assertTrue(MaskBuilderRegistry.hasPolicy("peaks"));
        assertFalse(MaskBuilderRegistry.hasPolicy("blur"));
    }

    @Test
    void createsFreshBuilders() {
        MaskBuilder peaks = MaskBuilderRegistry.createBuilder("peaks");
        MaskBuilder lines = MaskBuilderRegistry.createBuilder("lines");

        assertInstanceOf(PeakNotchMaskBuilder.class, peaks);
        assertInstanceOf(LineBandMaskBuilder.class, lines);
        assertEquals("peaks", peaks.getPolicyName());
        assertEquals("lines", lines.getPolicyName());
        assertNotSame(peaks, MaskBuilderRegistry.createBuilder("peaks"));
    }

    @Test
    void annotationNameMatchesPolicyName() {
        for (String name : MaskBuilderRegistry.getRegisteredPolicies()) {
            assertEquals(name, MaskBuilderRegistry.createBuilder(name).getPolicyName());
            assertFalse(MaskBuilderRegistry.getDescription(name).isEmpty());
        }
    }

    @Test
    void exactlyTheBuiltInPolicies() {
        assertEquals(Set.of("lines", "peaks"), MaskBuilderRegistry.getRegisteredPolicies());
    }

    @Test
    void unknownPolicyIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> MaskBuilderRegistry.createBuilder("wavelet"));
        assertTrue(e.getMessage().contains("lines"));
    }
}
