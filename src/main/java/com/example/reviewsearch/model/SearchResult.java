package com.example.reviewsearch.model;

import java.util.List;

/**
 * Payload of a search: the ranked reviews, their insights and the query that produced them.
 */
public class SearchResult {
    private final List<ReviewView> reviews;
    private final Insights insights;
    private final FilterQuery filterApplied;
    private final int totalFound;
    private final int totalScraped;
    private final String platform;
    private final String scrapedAt;
    private final String originalUrl;

    public SearchResult(List<ReviewView> reviews, Insights insights, FilterQuery filterApplied,
                        int totalScraped, String platform, String scrapedAt, String originalUrl) {
        this.reviews = List.copyOf(reviews);
        this.insights = insights;
        this.filterApplied = filterApplied;
        this.totalFound = reviews.size();
        this.totalScraped = totalScraped;
        this.platform = platform;
        this.scrapedAt = scrapedAt;
        this.originalUrl = originalUrl;
    }

    public List<ReviewView> getReviews() { return reviews; }
    public Insights getInsights() { return insights; }
    public FilterQuery getFilterApplied() { return filterApplied; }
    public int getTotalFound() { return totalFound; }
    public int getTotalScraped() { return totalScraped; }
    public String getPlatform() { return platform; }
    public String getScrapedAt() { return scrapedAt; }
    public String getOriginalUrl() { return originalUrl; }

    public String summary() {
        return "Found " + totalFound + " relevant reviews out of " + totalScraped + " total";
    }
}
