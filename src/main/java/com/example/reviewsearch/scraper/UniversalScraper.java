package com.example.reviewsearch.scraper;

import com.example.reviewsearch.error.FetchException;
import com.example.reviewsearch.error.UnsupportedPlatformException;
import com.example.reviewsearch.model.Review;
import com.example.reviewsearch.model.SiteConfig;
import com.example.reviewsearch.page.PageFetcher;
import com.example.reviewsearch.page.PageNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Scraper for every platform in the registry: resolve the platform, fetch the page,
 * hand it to the extractor.
 */
public class UniversalScraper implements Scraper {

    private static final Logger log = LoggerFactory.getLogger(UniversalScraper.class);

    private final SiteRegistry registry;
    private final PlatformDetector detector;
    private final PageFetcher fetcher;
    private final ReviewExtractor extractor;

    public UniversalScraper(SiteRegistry registry, PageFetcher fetcher) {
        this(registry, new PlatformDetector(registry), fetcher, new ReviewExtractor());
    }

    public UniversalScraper(SiteRegistry registry, PlatformDetector detector,
                            PageFetcher fetcher, ReviewExtractor extractor) {
        this.registry = registry;
        this.detector = detector;
        this.fetcher = fetcher;
        this.extractor = extractor;
    }

    @Override
    public List<Review> scrape(String url, String platform) throws UnsupportedPlatformException, FetchException {
        String platformId = resolvePlatform(url, platform);
        SiteConfig config = registry.get(platformId);

        PageNode document = fetcher.fetch(url);
        List<Review> reviews = extractor.extract(document, config, platformId, url);

        log.info("Retrieved {} reviews from {}", reviews.size(), config.getName());
        return reviews;
    }

    /**
     * The explicit platform when given, otherwise the one detected from the URL host.
     */
    public String resolvePlatform(String url, String platform) throws UnsupportedPlatformException {
        if (platform != null && !platform.isBlank()) {
            String id = platform.trim();
            if (registry.lookup(id).isEmpty()) {
                throw new UnsupportedPlatformException(
                        "Unsupported platform '" + id + "'. Supported: " + registry.ids(), registry.ids());
            }
            return id;
        }
        return detector.detect(url).orElseThrow(() -> new UnsupportedPlatformException(
                "Unsupported platform for " + url + ". Supported: " + registry.ids(), registry.ids()));
    }

    public SiteRegistry getRegistry() { return registry; }
}
