package com.reprise.service.canonicalization;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for QueryNormalizer.
 */
class QueryNormalizerTest {

    private QueryNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new QueryNormalizer();
    }

    @Test
    void testNormalizeCollapsesWhitespaceAndCase() {
        assertEquals("hello world", normalizer.normalize("  Hello   World  "));
        assertEquals("hello world", normalizer.normalize("hello\t\nworld"));
        assertEquals("", normalizer.normalize(null));
        assertEquals("", normalizer.normalize("   "));
    }

    @Test
    void testNormalizeIsIdempotent() {
        String once = normalizer.normalize("  What IS the  Main topic? ");
        assertEquals(once, normalizer.normalize(once));
    }

    @Test
    void testFingerprintIsStableSha256() {
        String a = normalizer.fingerprint(normalizer.normalize("  Hello   World "));
        String b = normalizer.fingerprint(normalizer.normalize("hello world"));

        assertEquals(a, b);
        assertEquals(64, a.length());
        assertTrue(a.matches("[0-9a-f]{64}"));
        assertNotEquals(a, normalizer.fingerprint("hello there"));
    }

    @Test
    void testTokenizeDeduplicatesAndLowercases() {
        Set<String> tokens = normalizer.tokenize("The cat and THE dog");

        assertEquals(List.of("the", "cat", "and", "dog"), List.copyOf(tokens));
        assertTrue(normalizer.tokenize("   ").isEmpty());
        assertTrue(normalizer.tokenize(null).isEmpty());
    }
}
