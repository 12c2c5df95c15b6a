package com.example.reviewsearch.scraper;

import com.example.reviewsearch.error.UnsupportedPlatformException;
import com.example.reviewsearch.model.PlatformInfo;
import com.example.reviewsearch.model.SiteConfig;
import com.example.reviewsearch.util.JsonConfig;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only table of supported platforms, kept in the order of resources/config/sites.json.
 * Adding a platform means adding one descriptor to that file.
 */
public final class SiteRegistry {

    private static final Logger log = LoggerFactory.getLogger(SiteRegistry.class);

    public static final String DEFAULT_RESOURCE = "sites.json";

    private final Map<String, SiteConfig> configs;

    public SiteRegistry(Map<String, SiteConfig> configs) {
        this.configs = Collections.unmodifiableMap(new LinkedHashMap<>(configs));
    }

    public static SiteRegistry fromDefaultConfig() {
        return fromConfig(JsonConfig.load(DEFAULT_RESOURCE));
    }

    public static SiteRegistry fromConfig(JsonConfig cfg) {
        JsonArray entries = cfg.getArray();
        Map<String, SiteConfig> configs = new LinkedHashMap<>();
        int index = 0;
        for (JsonElement el : entries) {
            String context = cfg.getPath() + "[" + index++ + "]";
            if (!el.isJsonObject()) {
                throw new IllegalStateException(context + ": expected an object");
            }
            JsonObject o = el.getAsJsonObject();
            String id = JsonConfig.requireString(o, "id", context).trim();
            if (id.isEmpty()) {
                throw new IllegalStateException(context + ": empty platform id");
            }
            if (configs.containsKey(id)) {
                throw new IllegalStateException(context + ": duplicate platform id '" + id + "'");
            }
            String domain = JsonConfig.requireString(o, "domain", context);
            if (domain.isBlank()) {
                throw new IllegalStateException(context + ": empty domain for '" + id + "'");
            }
            int ratingScale = JsonConfig.optInt(o, "ratingScale", SiteConfig.DEFAULT_RATING_SCALE);
            int maxReviews = JsonConfig.optInt(o, "maxReviews", SiteConfig.DEFAULT_MAX_REVIEWS);
            if (ratingScale <= 0 || maxReviews <= 0) {
                throw new IllegalStateException(context + ": ratingScale and maxReviews must be positive");
            }
            configs.put(id, new SiteConfig(
                    JsonConfig.optString(o, "name").orElse(id),
                    domain,
                    JsonConfig.requireString(o, "reviewContainer", context),
                    JsonConfig.requireString(o, "reviewerName", context),
                    JsonConfig.requireString(o, "rating", context),
                    JsonConfig.requireString(o, "reviewText", context),
                    JsonConfig.requireString(o, "date", context),
                    ratingScale,
                    maxReviews));
        }
        log.debug("Loaded {} platform descriptors from {}", configs.size(), cfg.getPath());
        return new SiteRegistry(configs);
    }

    public Optional<SiteConfig> lookup(String platformId) {
        if (platformId == null) return Optional.empty();
        return Optional.ofNullable(configs.get(platformId));
    }

    public SiteConfig get(String platformId) throws UnsupportedPlatformException {
        return lookup(platformId).orElseThrow(() -> new UnsupportedPlatformException(
                "Unsupported platform '" + platformId + "'. Supported: " + ids(), ids()));
    }

    public List<PlatformInfo> list() {
        List<PlatformInfo> out = new ArrayList<>(configs.size());
        for (Map.Entry<String, SiteConfig> e : configs.entrySet()) {
            out.add(new PlatformInfo(e.getKey(), e.getValue().getName(), e.getValue().getDomain()));
        }
        return out;
    }

    public List<String> ids() {
        return List.copyOf(configs.keySet());
    }

    /**
     * Entries in table order; detection walks this.
     */
    Iterable<Map.Entry<String, SiteConfig>> entries() {
        return configs.entrySet();
    }

    public int size() {
        return configs.size();
    }
}
