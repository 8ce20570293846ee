package com.reactive.xray.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValueType;

import java.util.Locale;
import java.util.Optional;

/**
 * Simple utility for accessing HOCON config values with Optional support.
 *
 * Eliminates boilerplate like:
 * <pre>
 *   // Before:
 *   return config.hasPath(path) ? Optional.of(config.getString(path)) : Optional.empty();
 *
 *   // After:
 *   return ConfigAccessor.string(config, path);
 * </pre>
 *
 * All methods follow the same pattern:
 * - Optional variant: returns Optional.empty() if path missing
 * - Default variant: returns default value if path missing
 */
public final class ConfigAccessor {

    private ConfigAccessor() {} // Utility class

    // =========================================================================
    // String
    // =========================================================================

    public static Optional<String> string(Config c, String path) {
        return c.hasPath(path) ? Optional.of(c.getString(path)) : Optional.empty();
    }

    public static String string(Config c, String path, String defaultValue) {
        return c.hasPath(path) ? c.getString(path) : defaultValue;
    }

    /**
     * Like {@link #string(Config, String)} but refuses values HOCON would coerce
     * (numbers, booleans). Present non-string values yield empty.
     */
    public static Optional<String> strictString(Config c, String path) {
        if (!c.hasPath(path) || c.getValue(path).valueType() != ConfigValueType.STRING) {
            return Optional.empty();
        }
        return Optional.of(c.getString(path));
    }

    // =========================================================================
    // Boolean
    // =========================================================================

    public static Optional<Boolean> bool(Config c, String path) {
        return c.hasPath(path) ? Optional.of(c.getBoolean(path)) : Optional.empty();
    }

    public static boolean bool(Config c, String path, boolean defaultValue) {
        return c.hasPath(path) ? c.getBoolean(path) : defaultValue;
    }

    // =========================================================================
    // Enum (case-insensitive, dashes map to underscores)
    // =========================================================================

    public static <E extends Enum<E>> E enumVal(Config c, String path, Class<E> type, E defaultValue) {
        if (!c.hasPath(path)) {
            return defaultValue;
        }
        String raw = c.getString(path).trim().replace('-', '_').toUpperCase(Locale.ROOT);
        return Enum.valueOf(type, raw);
    }

    // =========================================================================
    // Nested Config
    // =========================================================================

    public static Optional<Config> nested(Config c, String path) {
        return c.hasPath(path) ? Optional.of(c.getConfig(path)) : Optional.empty();
    }
}
