package io.github.cyfko.truthtable.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CachePolicyTest {

    @Test
    @DisplayName("Should expose presets")
    void shouldExposePresets() {
        assertTrue(CachePolicy.defaults().cacheEnabled());
        assertEquals(256, CachePolicy.defaults().cacheSize());
        assertFalse(CachePolicy.none().cacheEnabled());
        assertEquals(new CachePolicy(true, 32), CachePolicy.custom(32));
    }

    @Test
    @DisplayName("Should reject non-positive sizes")
    void shouldRejectNonPositiveSize() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> CachePolicy.custom(0));
        assertTrue(exception.getMessage().contains("0"));
        assertThrows(IllegalArgumentException.class, () -> new CachePolicy(false, -1));
    }
}
