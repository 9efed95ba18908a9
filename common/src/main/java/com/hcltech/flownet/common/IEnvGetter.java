package com.hcltech.flownet.common;

import java.util.Map;

/**
 * Source of named configuration values.
 * <p>
 * Code reads settings through this instead of {@link System#getenv(String)} so that
 * tests can supply their own values with {@link #mock(Map)}.
 */
@FunctionalInterface
public interface IEnvGetter {
    /** Backed by the process environment. */
    IEnvGetter env = System::getenv;

    /** Returns the value for {@code name}, or {@code null} if unset. */
    String get(String name);

    /** Use this getter first and fall back to {@code other} for unset or blank names. */
    default IEnvGetter orElse(IEnvGetter other) {
        return name -> {
            String value = get(name);
            return (value != null && !value.isBlank()) ? value : other.get(name);
        };
    }

    static IEnvGetter mock(Map<String, String> values) {
        return values::get;
    }

    static String getStringOr(IEnvGetter env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    /**
     * Returns the boolean for {@code name}, or {@code defaultValue} if unset or blank.
     * Only "true" and "false" (any case) are accepted.
     */
    static boolean getBooleanOr(IEnvGetter env, String name, boolean defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) return true;
        if (trimmed.equalsIgnoreCase("false")) return false;
        throw new IllegalStateException("Invalid boolean for " + name + " = '" + value + "'");
    }
}
