package com.visprog.common;

/**
 * Reads environment variables.
 * <p>
 * Code takes an {@code IEnvGetter} instead of calling {@link System#getenv(String)} so that
 * tests can pass a map-backed source.
 */
@FunctionalInterface
public interface IEnvGetter {

    IEnvGetter env = System::getenv;

    /** Value of the variable, or {@code null} if unset. */
    String get(String name);

    static String getStringOr(IEnvGetter env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    /**
     * Only "true" and "false" (any case) are accepted; anything else is a configuration error
     * rather than a silent {@code false}.
     */
    static boolean getBooleanOr(IEnvGetter env, String name, boolean defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        String v = value.trim();
        if (v.equalsIgnoreCase("true")) return true;
        if (v.equalsIgnoreCase("false")) return false;
        throw new IllegalStateException("Invalid boolean for environment variable: " + name + " = '" + value + "'");
    }
}
