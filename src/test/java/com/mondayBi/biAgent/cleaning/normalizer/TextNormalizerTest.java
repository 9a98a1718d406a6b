package com.mondayBi.biAgent.cleaning.normalizer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class TextNormalizerTest {

    @Test
    public void shouldTrimCollapseAndTitleCase() {
        assertEquals("Renewable Energy", TextNormalizer.normalize("  renewable    ENERGY "));
        assertEquals("Mining", TextNormalizer.normalize("mining"));
        assertEquals("Oil-And-Gas", TextNormalizer.normalize("oil-and-gas"));
    }

    @Test
    public void shouldReturnNullForBlankValues() {
        assertNull(TextNormalizer.normalize(null));
        assertNull(TextNormalizer.normalize("\t "));
    }
}
