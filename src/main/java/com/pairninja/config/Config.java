package com.pairninja.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Key/value configuration source.
 *
 * Values come from application.properties and can be overridden by environment
 * variables, either under the exact key or under its upper-case form with dots
 * replaced by underscores (strategy.entry.z -> STRATEGY_ENTRY_Z).
 * Malformed values are rejected with {@link ConfigException} instead of falling
 * back to a default.
 */
public class Config {

    public static final String BINANCE_API_KEY = "BINANCE_API_KEY";
    public static final String BINANCE_SECRET_KEY = "BINANCE_SECRET_KEY";
    public static final String MONGODB_URI = "MONGODB_URI";
    public static final String DB_NAME = "DB_NAME";
    public static final String PAPER_MODE = "PAPER_MODE";

    private static final String DEFAULT_RESOURCE = "application.properties";

    private final Properties properties;
    private final Map<String, String> environment;

    public Config(Properties properties, Map<String, String> environment) {
        this.properties = properties;
        this.environment = environment != null ? environment : Collections.emptyMap();
    }

    /**
     * Load application.properties from the classpath with process environment overrides.
     */
    public static Config load() {
        Properties properties = new Properties();
        try (InputStream input = Config.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input != null) {
                properties.load(input);
            }
        } catch (IOException e) {
            throw new ConfigException(DEFAULT_RESOURCE, "could not be read", e);
        }
        return new Config(properties, System.getenv());
    }

    /**
     * Load a properties file from disk with process environment overrides.
     */
    public static Config load(Path file) {
        Properties properties = new Properties();
        try (InputStream input = Files.newInputStream(file)) {
            properties.load(input);
        } catch (IOException e) {
            throw new ConfigException(file.toString(), "could not be read", e);
        }
        return new Config(properties, System.getenv());
    }

    public static Config fromProperties(Properties properties) {
        return new Config(properties, Collections.emptyMap());
    }

    public String get(String key) {
        String value = environment.get(key);
        if (value == null) {
            value = environment.get(key.toUpperCase(Locale.ROOT).replace('.', '_'));
        }
        if (value == null) {
            value = properties.getProperty(key);
        }
        if (value != null) {
            value = value.trim();
            if (value.isEmpty()) {
                return null;
            }
        }
        return value;
    }

    public String get(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    public boolean has(String key) {
        return get(key) != null;
    }

    public double getDouble(String key, double defaultValue) {
        Double value = getOptionalDouble(key);
        return value != null ? value : defaultValue;
    }

    public Double getOptionalDouble(String key) {
        String value = get(key);
        if (value == null) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value);
            if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
                throw new ConfigException(key, "must be a finite number, got " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ConfigException(key, "invalid number format: " + value, e);
        }
    }

    public int getInt(String key, int defaultValue) {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigException(key, "invalid integer format: " + value, e);
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigException(key, "invalid integer format: " + value, e);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new ConfigException(key, "expected true or false, got " + value);
    }

    public <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        return parseEnum(key, type, value);
    }

    /**
     * Comma separated list of enum constants. Returns the default when the key is absent.
     */
    public <E extends Enum<E>> List<E> getEnumList(String key, Class<E> type, List<E> defaultValue) {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        List<E> result = new ArrayList<>();
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(parseEnum(key, type, trimmed));
            }
        }
        return result;
    }

    private static <E extends Enum<E>> E parseEnum(String key, Class<E> type, String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(key, "unknown " + type.getSimpleName() + " value: " + value, e);
        }
    }
}
