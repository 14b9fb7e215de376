package com.crossbot.application.ports;

import com.crossbot.domain.ConfigurationException;

/**
 * Abstraction over configuration and secrets.
 * Infrastructure provides implementation (file/env).
 */
public interface ConfigPort {

    String get(String key);

    String get(String key, String defaultValue);

    /** Returns a secret value; never logged. */
    String getSecret(String key);

    default int getInt(String key, int defaultValue) {
        String v = get(key, null);
        if (v == null || v.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, got: " + v);
        }
    }

    default long getLong(String key, long defaultValue) {
        String v = get(key, null);
        if (v == null || v.isBlank()) return defaultValue;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, got: " + v);
        }
    }

    default double getDouble(String key, double defaultValue) {
        String v = get(key, null);
        if (v == null || v.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be a number, got: " + v);
        }
    }

    default boolean getBoolean(String key, boolean defaultValue) {
        String v = get(key, null);
        if (v == null || v.isBlank()) return defaultValue;
        return Boolean.parseBoolean(v.trim());
    }
}
