package com.qqsuccubus.pacer.core.settings;

import com.google.common.collect.ImmutableMap;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ISettingsStore} backed by a {@link ConcurrentHashMap}.
 */
public class InMemorySettingsStore implements ISettingsStore {

    private final Map<String, Object> initial;
    private final Map<String, Object> values = new ConcurrentHashMap<>();

    public InMemorySettingsStore() {
        this(Map.of());
    }

    /**
     * @param initial Seed entries, also restored by {@link #reset()}; null values are skipped
     */
    public InMemorySettingsStore(Map<String, ?> initial) {
        ImmutableMap.Builder<String, Object> seed = ImmutableMap.builder();
        initial.forEach((key, value) -> {
            if (key != null && value != null) {
                seed.put(key, value);
            }
        });
        this.initial = seed.build();
        this.values.putAll(this.initial);
    }

    /**
     * Creates a store seeded with the process environment.
     */
    public static InMemorySettingsStore fromEnv() {
        return new InMemorySettingsStore(System.getenv());
    }

    @Override
    public Object get(String key, Object defaultValue) {
        Object value = values.get(key);
        return value != null ? value : defaultValue;
    }

    @Override
    public void set(String key, Object value) {
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    @Override
    public void update(Map<String, ?> entries) {
        entries.forEach(this::set);
    }

    @Override
    public Map<String, Object> snapshot() {
        return new HashMap<>(values);
    }

    @Override
    public void reset() {
        values.clear();
        values.putAll(initial);
    }
}
