package com.example.reviewsearch.util;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads a JSON configuration file from resources/config/.
 *
 * Example:
 *   JsonConfig cfg = JsonConfig.load("fetch.json");
 *   int timeout = cfg.getInt("timeoutMs", 10000);
 */
public class JsonConfig {

    private final String path;
    private final JsonElement root;

    private JsonConfig(String path, JsonElement root) {
        this.path = path;
        this.root = root;
    }

    public static JsonConfig load(String fileName) {
        String path = "/config/" + fileName;
        InputStream in = JsonConfig.class.getResourceAsStream(path);
        if (in == null) {
            throw new IllegalArgumentException("Could not find config file: " + path);
        }
        try (InputStreamReader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return new JsonConfig(path, JsonParser.parseReader(reader));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read config file: " + path, e);
        } catch (JsonParseException e) {
            throw new IllegalStateException("Config file is not valid JSON: " + path, e);
        }
    }

    public static JsonConfig parse(String name, String json) {
        return new JsonConfig(name, JsonParser.parseString(json));
    }

    public String getPath() { return path; }

    public JsonObject getObject() {
        if (!root.isJsonObject()) {
            throw new IllegalStateException(path + " does not hold a JSON object");
        }
        return root.getAsJsonObject();
    }

    public JsonArray getArray() {
        if (!root.isJsonArray()) {
            throw new IllegalStateException(path + " does not hold a JSON array");
        }
        return root.getAsJsonArray();
    }

    public int getInt(String key, int fallback) {
        return integer(getObject(), key, fallback);
    }

    public boolean getBoolean(String key, boolean fallback) {
        JsonObject obj = getObject();
        if (obj.has(key) && !obj.get(key).isJsonNull()) {
            return obj.get(key).getAsBoolean();
        }
        return fallback;
    }

    static Optional<String> string(JsonObject obj, String key) {
        if (obj.has(key) && !obj.get(key).isJsonNull()) {
            return Optional.of(obj.get(key).getAsString());
        }
        return Optional.empty();
    }

    static int integer(JsonObject obj, String key, int fallback) {
        if (obj.has(key) && !obj.get(key).isJsonNull()) {
            return obj.get(key).getAsInt();
        }
        return fallback;
    }

    /**
     * Required string member of a nested object, used when reading arrays of descriptors.
     */
    public static String requireString(JsonObject obj, String key, String context) {
        return string(obj, key)
                .orElseThrow(() -> new IllegalStateException(context + ": missing '" + key + "'"));
    }

    public static Optional<String> optString(JsonObject obj, String key) {
        return string(obj, key);
    }

    public static int optInt(JsonObject obj, String key, int fallback) {
        return integer(obj, key, fallback);
    }

    @Override
    public String toString() {
        return Objects.toString(root);
    }
}
