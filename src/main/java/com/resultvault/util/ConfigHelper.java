package com.resultvault.util;

import com.resultvault.storage.StorageConfigurationException;
import org.springframework.core.env.Environment;

/**
 * Utility class for reading configuration properties once at startup.
 * Provides fail-fast behavior for malformed values and safe defaults for optional ones.
 */
public final class ConfigHelper {

    private ConfigHelper() {
        // Utility class
    }

    /**
     * Reads an optional configuration property with a default value.
     *
     * @param env The Spring Environment
     * @param key The property key
     * @param defaultValue The default value to use if the property is missing or blank
     * @return The trimmed property value or defaultValue if missing/blank
     */
    public static String optionalProperty(Environment env, String key, String defaultValue) {
        String value = env.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue != null ? defaultValue : "";
        }
        return value.trim();
    }

    /**
     * Reads an optional positive integer property. Missing or blank means "not set".
     *
     * @param env The Spring Environment
     * @param key The property key
     * @return The parsed value, or null if the property is missing/blank
     * @throws StorageConfigurationException if the value is not a positive integer
     */
    public static Integer optionalPositiveInt(Environment env, String key) {
        String value = env.getProperty(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new StorageConfigurationException(
                    String.format("Configuration property '%s' must be an integer, got '%s'", key, value), e);
        }
        if (parsed <= 0) {
            throw new StorageConfigurationException(
                    String.format("Configuration property '%s' must be positive, got %d", key, parsed));
        }
        return parsed;
    }
}
