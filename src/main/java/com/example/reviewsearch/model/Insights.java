package com.example.reviewsearch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary statistics over a filtered review set.
 */
public final class Insights {

    private final int totalReviews;
    private final double averageRating;
    private final Map<String, Integer> categoryBreakdown;
    private final Map<String, Integer> sentimentBreakdown;
    private final List<String> topCategories;
    private final Map<String, Integer> ratingDistribution;

    public Insights(int totalReviews, double averageRating,
                    Map<String, Integer> categoryBreakdown,
                    Map<String, Integer> sentimentBreakdown,
                    List<String> topCategories,
                    Map<String, Integer> ratingDistribution) {
        this.totalReviews = totalReviews;
        this.averageRating = averageRating;
        this.categoryBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(categoryBreakdown));
        this.sentimentBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(sentimentBreakdown));
        this.topCategories = List.copyOf(topCategories);
        this.ratingDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(ratingDistribution));
    }

    public int getTotalReviews() { return totalReviews; }
    public double getAverageRating() { return averageRating; }
    public Map<String, Integer> getCategoryBreakdown() { return categoryBreakdown; }
    public Map<String, Integer> getSentimentBreakdown() { return sentimentBreakdown; }
    public List<String> getTopCategories() { return topCategories; }
    public Map<String, Integer> getRatingDistribution() { return ratingDistribution; }
}
