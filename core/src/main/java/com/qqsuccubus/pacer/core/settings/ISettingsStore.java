package com.qqsuccubus.pacer.core.settings;

import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Thread-safe key/value settings store that thread counts, thresholds and rate
 * defaults originate from.
 * <p>
 * Typed getters coerce stored strings and numbers and fall back to the supplied default
 * when a value is missing or cannot be parsed.
 * </p>
 */
public interface ISettingsStore {

    Set<String> TRUTHY = Set.of("true", "1", "yes", "on");

    /**
     * Returns the stored value, or {@code defaultValue} if the key is absent.
     */
    Object get(String key, Object defaultValue);

    /**
     * Stores a value; a {@code null} value removes the key.
     */
    void set(String key, Object value);

    /**
     * Stores every entry of the given map.
     */
    void update(Map<String, ?> values);

    /**
     * Returns a copy of every stored entry.
     */
    Map<String, Object> snapshot();

    /**
     * Restores the store to the entries it was created with.
     */
    void reset();

    default String getString(String key, String defaultValue) {
        Object value = get(key, defaultValue);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    default int getInt(String key, int defaultValue) {
        Object value = get(key, null);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            Integer parsed = Ints.tryParse(text.trim());
            return parsed != null ? parsed : defaultValue;
        }
        return defaultValue;
    }

    default long getLong(String key, long defaultValue) {
        Object value = get(key, null);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            Long parsed = Longs.tryParse(text.trim());
            return parsed != null ? parsed : defaultValue;
        }
        return defaultValue;
    }

    default double getDouble(String key, double defaultValue) {
        Object value = get(key, null);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            Double parsed = Doubles.tryParse(text.trim());
            return parsed != null ? parsed : defaultValue;
        }
        return defaultValue;
    }

    default boolean getBoolean(String key, boolean defaultValue) {
        Object value = get(key, null);
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            return TRUTHY.contains(text.trim().toLowerCase(Locale.ROOT));
        }
        if (value instanceof Number number) {
            return number.longValue() != 0;
        }
        return defaultValue;
    }
}
