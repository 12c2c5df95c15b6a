package com.example.reviewsearch.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * A review plus the fields derived for one filter pass.
 */
public final class AnnotatedReview {

    private final Review review;
    private final Sentiment sentiment;
    private final Set<Category> categories;
    private final double keywordRelevance;
    private final String relevancePercentage;

    public AnnotatedReview(Review review, Sentiment sentiment, Set<Category> categories,
                           double keywordRelevance, boolean keywordQuery) {
        this.review = review;
        this.sentiment = sentiment;
        this.categories = Collections.unmodifiableSet(categories.isEmpty()
                ? EnumSet.noneOf(Category.class) : EnumSet.copyOf(categories));
        this.keywordRelevance = keywordRelevance;
        this.relevancePercentage = keywordQuery
                ? String.format(Locale.ROOT, "%.1f%%", keywordRelevance * 100)
                : "100%";
    }

    public Review getReview() { return review; }
    public Sentiment getSentiment() { return sentiment; }
    public Set<Category> getCategories() { return categories; }
    public double getKeywordRelevance() { return keywordRelevance; }
    public String getRelevancePercentage() { return relevancePercentage; }

    // shortcuts used by the ranker and aggregator
    public double getRating() { return review.getRating(); }
    public String getReviewText() { return review.getReviewText() == null ? "" : review.getReviewText(); }
    public String getDate() { return review.getDate() == null ? "" : review.getDate(); }
}
