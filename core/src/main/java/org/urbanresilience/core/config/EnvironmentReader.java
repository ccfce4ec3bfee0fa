package org.urbanresilience.core.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Resolves configuration values from the process environment, then from a {@code .env} file in the
 * working directory, then from {@code ../.env}.
 */
public final class EnvironmentReader {

    private static final Logger LOG = LoggerFactory.getLogger(EnvironmentReader.class);

    private final Map<String, String> environment;
    private final Dotenv localDotenv;
    private final Dotenv parentDotenv;

    private EnvironmentReader(Map<String, String> environment, Dotenv localDotenv, Dotenv parentDotenv) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.localDotenv = localDotenv;
        this.parentDotenv = parentDotenv;
    }

    public static EnvironmentReader system() {
        Dotenv local = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        Dotenv parent = Dotenv.configure()
                .directory("../")
                .ignoreIfMissing()
                .load();
        return new EnvironmentReader(System.getenv(), local, parent);
    }

    /**
     * Reader backed only by the given map. Used by tests and embedding callers.
     */
    public static EnvironmentReader of(Map<String, String> values) {
        return new EnvironmentReader(values, null, null);
    }

    public String get(String key, String defaultValue) {
        String value = lookup(key);
        if (value == null) {
            LOG.debug("Using default for {}: {}", key, defaultValue);
            return defaultValue;
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        String value = lookup(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            LOG.warn("Invalid integer for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = lookup(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            LOG.warn("Invalid number for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = lookup(key);
        if (value == null) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    public OptionalLong getLong(String key) {
        String value = lookup(key);
        if (value == null) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(value));
        } catch (NumberFormatException e) {
            LOG.warn("Invalid long for {}: {}, ignoring", key, value);
            return OptionalLong.empty();
        }
    }

    private String lookup(String key) {
        String value = trimmed(environment.get(key));
        if (value == null && localDotenv != null) {
            value = trimmed(localDotenv.get(key));
        }
        if (value == null && parentDotenv != null) {
            value = trimmed(parentDotenv.get(key));
        }
        return value;
    }

    private static String trimmed(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }
}
