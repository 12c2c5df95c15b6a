package com.example.reviewsearch.scraper;

import com.example.reviewsearch.model.SiteConfig;
import com.example.reviewsearch.util.UrlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Maps a URL to a platform id by host substring. The first registry entry that matches wins.
 */
public class PlatformDetector {

    private static final Logger log = LoggerFactory.getLogger(PlatformDetector.class);

    private final SiteRegistry registry;

    public PlatformDetector(SiteRegistry registry) {
        this.registry = registry;
    }

    public Optional<String> detect(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        Optional<String> parsed = UrlValidator.host(url);
        if (parsed.isEmpty()) {
            log.debug("Cannot detect platform of URL without a host: {}", url);
            return Optional.empty();
        }
        String host = parsed.get();

        for (Map.Entry<String, SiteConfig> e : registry.entries()) {
            if (host.contains(e.getValue().getDomain())) {
                return Optional.of(e.getKey());
            }
        }
        return Optional.empty();
    }
}
