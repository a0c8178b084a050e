package com.ttennebkram.texturefix.config;

import com.google.gson.*;

import java.io.*;
import java.nio.charset.StandardCharsets;

/**
 * Reads and writes FilterConfig as a JSON document.
 * Missing keys fall back to the defaults, so a file may set just one field:
 * <pre>
 * { "method": "lines", "lineWidth": 3 }
 * </pre>
 */
public class FilterConfigSerializer {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    static final String KEY_METHOD = "method";
    static final String KEY_THRESHOLD = "thresholdPercentile";
    static final String KEY_NOTCH_RADIUS = "notchRadius";
    static final String KEY_PROTECT_CENTER = "protectCenter";
    static final String KEY_LINE_WIDTH = "lineWidth";
    static final String KEY_ATTENUATION = "attenuation";

    public static JsonObject toJson(FilterConfig config) {
        JsonObject json = new JsonObject();
        json.addProperty(KEY_METHOD, config.getPolicy());
        json.addProperty(KEY_THRESHOLD, config.getThresholdPercentile());
        json.addProperty(KEY_NOTCH_RADIUS, config.getNotchRadius());
        json.addProperty(KEY_PROTECT_CENTER, config.getProtectCenter());
        json.addProperty(KEY_LINE_WIDTH, config.getLineWidth());
        json.addProperty(KEY_ATTENUATION, config.getAttenuation());
        return json;
    }

    /**
     * @throws IllegalArgumentException if a present key has the wrong type
     */
    public static FilterConfig fromJson(JsonObject json) {
        FilterConfig.Builder builder = FilterConfig.builder();
        try {
            if (json.has(KEY_METHOD)) {
                builder.policy(json.get(KEY_METHOD).getAsString());
            }
            if (json.has(KEY_THRESHOLD)) {
                builder.thresholdPercentile(json.get(KEY_THRESHOLD).getAsDouble());
            }
            if (json.has(KEY_NOTCH_RADIUS)) {
                builder.notchRadius(json.get(KEY_NOTCH_RADIUS).getAsInt());
            }
            if (json.has(KEY_PROTECT_CENTER)) {
                builder.protectCenter(json.get(KEY_PROTECT_CENTER).getAsInt());
            }
            if (json.has(KEY_LINE_WIDTH)) {
                builder.lineWidth(json.get(KEY_LINE_WIDTH).getAsInt());
            }
            if (json.has(KEY_ATTENUATION)) {
                builder.attenuation(json.get(KEY_ATTENUATION).getAsDouble());
            }
        } catch (ClassCastException | IllegalStateException | UnsupportedOperationException e) {
            throw new IllegalArgumentException("Invalid filter config value: " + e.getMessage(), e);
        }
        return builder.build();
    }

    /**
     * Save a filter config to a JSON file.
     */
    public static void save(String path, FilterConfig config) throws IOException {
        try (Writer writer = new OutputStreamWriter(new FileOutputStream(path), StandardCharsets.UTF_8)) {
            GSON.toJson(toJson(config), writer);
        }
    }

    /**
     * Load a filter config from a JSON file.
     */
    public static FilterConfig load(String path) throws IOException {
        JsonObject root;
        try (Reader reader = new InputStreamReader(new FileInputStream(path), StandardCharsets.UTF_8)) {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (parsed == null || !parsed.isJsonObject()) {
                throw new IOException("Invalid filter config file: not a valid JSON object");
            }
            root = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IOException("Invalid filter config file: " + e.getMessage(), e);
        }

        try {
            return fromJson(root);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid filter config file " + path + ": " + e.getMessage(), e);
        }
    }
}
