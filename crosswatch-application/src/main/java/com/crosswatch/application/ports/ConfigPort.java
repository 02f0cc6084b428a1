package com.crosswatch.application.ports;

/**
 * Abstraction over configuration and secrets.
 * Infrastructure provides implementation (file/env).
 */
public interface ConfigPort {

    String get(String key);

    String get(String key, String defaultValue);

    int getInt(String key, int defaultValue);

    double getDouble(String key, double defaultValue);

    default long getLong(String key, long defaultValue) {
        String v = get(key, null);
        if (v == null) return defaultValue;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    default boolean getBoolean(String key, boolean defaultValue) {
        String v = get(key, null);
        return (v == null || v.isBlank()) ? defaultValue : Boolean.parseBoolean(v.trim());
    }

    /** Returns a secret value (API keys, bot tokens). */
    String getSecret(String key);
}
