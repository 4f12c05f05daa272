package com.qqsuccubus.pacer.core.settings;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemorySettingsStoreTest {

    private InMemorySettingsStore store;

    @BeforeEach
    void setUp() {
        store = new InMemorySettingsStore(Map.of("THREAD_NUM", "10", "POOL_CPU_THRESHOLD", 85.0));
    }

    @Test
    void testTypedGetters_CoerceStringsAndNumbers() {
        store.set("RATE_MAX", " 40 ");
        store.set("RETRY_BACKOFF_MS", 1500);

        assertEquals(10, store.getInt("THREAD_NUM", 1));
        assertEquals(40, store.getInt("RATE_MAX", 50));
        assertEquals(1500L, store.getLong("RETRY_BACKOFF_MS", 1000L));
        assertEquals(85.0, store.getDouble("POOL_CPU_THRESHOLD", 0.0));
        assertEquals("10", store.getString("THREAD_NUM", null));
    }

    @Test
    void testTypedGetters_FallBackOnMissingOrUnparsable() {
        store.set("THREAD_NUM", "ten");

        assertEquals(7, store.getInt("THREAD_NUM", 7));
        assertEquals(3, store.getInt("MISSING", 3));
        assertEquals(2.5, store.getDouble("MISSING", 2.5));
        assertEquals("fallback", store.getString("MISSING", "fallback"));
    }

    @Test
    void testGetBoolean_TruthyStrings() {
        store.update(Map.of("A", "true", "B", "YES", "C", "1", "D", "on", "E", "nope"));

        assertTrue(store.getBoolean("A", false));
        assertTrue(store.getBoolean("B", false));
        assertTrue(store.getBoolean("C", false));
        assertTrue(store.getBoolean("D", false));
        assertFalse(store.getBoolean("E", true));
        assertTrue(store.getBoolean("MISSING", true));
    }

    @Test
    void testSetNull_RemovesKey() {
        store.set("THREAD_NUM", null);

        assertNull(store.get("THREAD_NUM", null));
        assertFalse(store.snapshot().containsKey("THREAD_NUM"));
    }

    @Test
    void testReset_RestoresInitialEntries() {
        store.set("THREAD_NUM", "99");
        store.set("EXTRA", "x");

        store.reset();

        assertEquals(Map.of("THREAD_NUM", "10", "POOL_CPU_THRESHOLD", 85.0), store.snapshot());
    }

    @Test
    void testSnapshot_IsACopy() {
        Map<String, Object> snapshot = store.snapshot();
        snapshot.put("EXTRA", "x");

        assertNull(store.get("EXTRA", null));
    }

    @Test
    void testNullSeedValue_Skipped() {
        Map<String, Object> seed = new HashMap<>();
        seed.put("THREAD_NUM", "8");
        seed.put("POOL_MAX_WORKERS", null);

        InMemorySettingsStore seeded = new InMemorySettingsStore(seed);

        assertEquals(8, seeded.getInt("THREAD_NUM", 1));
        assertEquals(20, seeded.getInt("POOL_MAX_WORKERS", 20));
        assertFalse(seeded.snapshot().containsKey("POOL_MAX_WORKERS"));

        seeded.set("THREAD_NUM", "4");
        seeded.reset();
        assertEquals(8, seeded.getInt("THREAD_NUM", 1));
    }
}
