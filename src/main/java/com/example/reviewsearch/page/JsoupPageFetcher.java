package com.example.reviewsearch.page;

import com.example.reviewsearch.error.FetchException;
import com.example.reviewsearch.util.JsonConfig;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain HTTP fetcher: one GET with browser-like headers, parsed by Jsoup.
 * Settings come from resources/config/fetch.json.
 */
public class JsoupPageFetcher implements PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(JsoupPageFetcher.class);

    static final int DEFAULT_TIMEOUT_MS = 10_000;

    private final int timeoutMs;
    private final boolean followRedirects;
    private final int maxBodyBytes;
    private final Map<String, String> headers;

    public JsoupPageFetcher(int timeoutMs, boolean followRedirects, int maxBodyBytes, Map<String, String> headers) {
        this.timeoutMs = timeoutMs;
        this.followRedirects = followRedirects;
        this.maxBodyBytes = maxBodyBytes;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static JsoupPageFetcher fromConfig(JsonConfig cfg) {
        Map<String, String> headers = new LinkedHashMap<>();
        JsonObject obj = cfg.getObject();
        if (obj.has("headers") && obj.get("headers").isJsonObject()) {
            for (Map.Entry<String, JsonElement> e : obj.getAsJsonObject("headers").entrySet()) {
                headers.put(e.getKey(), e.getValue().getAsString());
            }
        }
        return new JsoupPageFetcher(
                cfg.getInt("timeoutMs", DEFAULT_TIMEOUT_MS),
                cfg.getBoolean("followRedirects", true),
                cfg.getInt("maxBodyBytes", 0),
                headers);
    }

    public static JsoupPageFetcher fromDefaultConfig() {
        return fromConfig(JsonConfig.load("fetch.json"));
    }

    public int getTimeoutMs() { return timeoutMs; }

    public Map<String, String> getHeaders() { return headers; }

    @Override
    public PageNode fetch(String url) throws FetchException {
        try {
            Connection conn = Jsoup.connect(url)
                    .headers(headers)
                    .timeout(timeoutMs)
                    .followRedirects(followRedirects)
                    .maxBodySize(maxBodyBytes);
            log.debug("GET {} (timeout {} ms)", url, timeoutMs);
            Document doc = conn.get();
            return new JsoupPageNode(doc);
        } catch (HttpStatusException e) {
            log.error("HTTP {} while fetching {}", e.getStatusCode(), url);
            throw new FetchException(url, "HTTP " + e.getStatusCode() + " fetching " + url, e);
        } catch (IOException e) {
            log.error("Network error while fetching {}: {}", url, e.getMessage());
            throw new FetchException(url, "Network error fetching " + url + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            // jsoup rejects malformed URLs this way
            log.error("Malformed URL {}", url);
            throw new FetchException(url, "Cannot fetch " + url + ": " + e.getMessage(), e);
        }
    }
}
