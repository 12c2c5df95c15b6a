package com.example.reviewsearch.model;

import java.util.Objects;

/**
 * Immutable description of where a platform keeps its review fields.
 * Selectors are CSS queries handed to the page layer as-is.
 */
public final class SiteConfig {

    public static final int DEFAULT_RATING_SCALE = 5;
    public static final int DEFAULT_MAX_REVIEWS = 10;

    private final String name;
    private final String domain;
    private final String reviewContainer;
    private final String reviewerName;
    private final String rating;
    private final String reviewText;
    private final String date;
    private final int ratingScale;
    private final int maxReviews;

    public SiteConfig(String name, String domain, String reviewContainer, String reviewerName,
                      String rating, String reviewText, String date, int ratingScale, int maxReviews) {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain must not be empty for site " + name);
        }
        this.name = name;
        this.domain = domain.trim().toLowerCase(java.util.Locale.ROOT);
        this.reviewContainer = reviewContainer;
        this.reviewerName = reviewerName;
        this.rating = rating;
        this.reviewText = reviewText;
        this.date = date;
        this.ratingScale = ratingScale;
        this.maxReviews = maxReviews;
    }

    public SiteConfig(String name, String domain, String reviewContainer, String reviewerName,
                      String rating, String reviewText, String date) {
        this(name, domain, reviewContainer, reviewerName, rating, reviewText, date,
                DEFAULT_RATING_SCALE, DEFAULT_MAX_REVIEWS);
    }

    public String getName() { return name; }
    public String getDomain() { return domain; }
    public String getReviewContainer() { return reviewContainer; }
    public String getReviewerName() { return reviewerName; }
    public String getRating() { return rating; }
    public String getReviewText() { return reviewText; }
    public String getDate() { return date; }
    public int getRatingScale() { return ratingScale; }
    public int getMaxReviews() { return maxReviews; }

    public SiteConfig withMaxReviews(int maxReviews) {
        return new SiteConfig(name, domain, reviewContainer, reviewerName, rating, reviewText, date,
                ratingScale, maxReviews);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SiteConfig)) return false;
        SiteConfig that = (SiteConfig) o;
        return ratingScale == that.ratingScale && maxReviews == that.maxReviews
                && Objects.equals(name, that.name) && domain.equals(that.domain)
                && Objects.equals(reviewContainer, that.reviewContainer)
                && Objects.equals(reviewerName, that.reviewerName)
                && Objects.equals(rating, that.rating)
                && Objects.equals(reviewText, that.reviewText)
                && Objects.equals(date, that.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, domain, reviewContainer, reviewerName, rating, reviewText, date,
                ratingScale, maxReviews);
    }

    @Override
    public String toString() {
        return "SiteConfig{" + name + " @ " + domain + ", container=" + reviewContainer + "}";
    }
}
