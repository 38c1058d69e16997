package io.upgradejourney.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility class for environment variable operations
 */
public final class EnvironmentUtils {

    private EnvironmentUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Get environment variable with default value
     *
     * @param name the environment variable name
     * @param defaultValue the default value to return if not set
     * @return the trimmed environment variable value or default if not set
     */
    public static String getEnv(String name, String defaultValue) {
        String value = System.getenv(name);
        return value != null ? value.trim() : defaultValue;
    }

    /**
     * Get a comma separated environment variable as a list, or empty if not set.
     */
    public static List<String> getEnvList(String name) {
        return splitList(System.getenv(name));
    }

    /**
     * Split a comma separated value, dropping blank entries.
     *
     * @param value raw value, may be null
     * @return trimmed, non-blank entries in order
     */
    public static List<String> splitList(String value) {
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }
}
