package com.rpgtools.prereq.common;

import java.util.Map;

/**
 * Source of environment settings. Code reads settings through this rather than {@link System#getenv(String)}
 * so tests can hand in a map.
 */
@FunctionalInterface
public interface IEnvGetter {

    IEnvGetter env = System::getenv;

    /** The raw value, or {@code null} if unset. */
    String get(String name);

    static IEnvGetter of(Map<String, String> values) {
        Map<String, String> copy = Map.copyOf(values);
        return copy::get;
    }

    /** Only a case-insensitive {@code true} is true. Unset or blank gives the default. */
    default boolean booleanOr(String name, boolean defaultValue) {
        String value = get(name);
        return value == null || value.isBlank() ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    /**
     * @throws IllegalStateException when the value is set but not an integer
     */
    default int intOr(String name, int defaultValue) {
        String value = get(name);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for environment variable: " + name + " = '" + value + "'", e);
        }
    }
}
