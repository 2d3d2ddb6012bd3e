package com.mimecast.wren.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.Strictness;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Map backed typed accessors shared by configuration classes.
 * <p>Files are JSON read with Gson in lenient mode so JSON5 comments and unquoted keys are accepted.
 * <br>Gson maps every number to a double, accessors convert as needed.
 */
public class ConfigFoundation {
    private static final Gson GSON = new GsonBuilder().setStrictness(Strictness.LENIENT).create();
    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new ConfigFoundation instance.
     */
    public ConfigFoundation() {
        // Empty.
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        this.map = map != null ? map : new HashMap<>();
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(String path) throws IOException {
        try (Reader reader = Files.newBufferedReader(Paths.get(path), StandardCharsets.UTF_8)) {
            Map<String, Object> parsed = GSON.fromJson(reader, MAP_TYPE);
            this.map = parsed != null ? parsed : new HashMap<>();
        } catch (JsonParseException e) {
            throw new IOException("Invalid configuration file: " + path, e);
        }
    }

    /**
     * Checks if key exists.
     *
     * @param key Key string.
     * @return Boolean.
     */
    public boolean hasProperty(String key) {
        return map.containsKey(key) && map.get(key) != null;
    }

    /**
     * Gets boolean property.
     *
     * @param key          Key string.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    /**
     * Gets long property.
     *
     * @param key          Key string.
     * @param defaultValue Default value.
     * @return Long.
     */
    public long getLongProperty(String key, long defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Gets int property.
     * <p>Values outside the int range fall back to the default.
     *
     * @param key          Key string.
     * @param defaultValue Default value.
     * @return Integer.
     */
    public int getIntProperty(String key, int defaultValue) {
        long value = getLongProperty(key, defaultValue);
        return value < Integer.MIN_VALUE || value > Integer.MAX_VALUE ? defaultValue : (int) value;
    }

    /**
     * Gets double property.
     *
     * @param key          Key string.
     * @param defaultValue Default value.
     * @return Double.
     */
    public double getDoubleProperty(String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Gets string property.
     *
     * @param key          Key string.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    /**
     * Gets list property.
     *
     * @param key Key string.
     * @return List, empty if missing or not a list.
     */
    public List<?> getListProperty(String key) {
        Object value = map.get(key);
        return value instanceof List ? (List<?>) value : new ArrayList<>();
    }

    /**
     * Gets map property.
     *
     * @param key Key string.
     * @return Map, empty if missing or not a map.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getMapProperty(String key) {
        Object value = map.get(key);
        return value instanceof Map ? (Map<String, Object>) value : new HashMap<>();
    }

    /**
     * Gets configuration map.
     *
     * @return Map.
     */
    public Map<String, Object> getMap() {
        return map;
    }
}
