package com.example.reviewsearch.model;

import java.util.List;

/**
 * Payload of a plain scrape: every extracted review, formatted.
 */
public class ScrapeResult {
    private final List<ReviewView> reviews;
    private final int totalReviews;
    private final String platform;
    private final String scrapedAt;
    private final String originalUrl;

    public ScrapeResult(List<ReviewView> reviews, String platform, String scrapedAt, String originalUrl) {
        this.reviews = List.copyOf(reviews);
        this.totalReviews = reviews.size();
        this.platform = platform;
        this.scrapedAt = scrapedAt;
        this.originalUrl = originalUrl;
    }

    public List<ReviewView> getReviews() { return reviews; }
    public int getTotalReviews() { return totalReviews; }
    public String getPlatform() { return platform; }
    public String getScrapedAt() { return scrapedAt; }
    public String getOriginalUrl() { return originalUrl; }
}
