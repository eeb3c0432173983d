package io.github.cyfko.tgrep.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CachePolicy Tests")
class CachePolicyTest {

    @Test
    @DisplayName("Presets")
    void presets() {
        assertEquals(new CachePolicy(true, 1000), CachePolicy.defaults());
        assertEquals(new CachePolicy(true, 500), CachePolicy.strict());
        assertEquals(new CachePolicy(true, 2000), CachePolicy.relaxed());
        assertFalse(CachePolicy.none().cacheEnabled());
        assertEquals(42, CachePolicy.custom(42).cacheSize());
    }

    @Test
    @DisplayName("Should reject non-positive cache size")
    void rejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> CachePolicy.custom(0));
        assertThrows(IllegalArgumentException.class, () -> new CachePolicy(true, -5));
    }
}
