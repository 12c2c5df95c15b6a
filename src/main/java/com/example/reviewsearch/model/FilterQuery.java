package com.example.reviewsearch.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * What the caller is looking for. Empty keyword and category collections disable the
 * corresponding filter.
 */
public final class FilterQuery {

    public static final double DEFAULT_MIN_RATING = 0;
    public static final double DEFAULT_MAX_RATING = 5;
    public static final int DEFAULT_LIMIT = 50;

    private final List<String> keywords;
    private final Set<Category> categories;
    private final double minRating;
    private final double maxRating;
    private final Sentiment sentiment;
    private final SortBy sortBy;
    private final int limit;

    private FilterQuery(Builder b) {
        this.keywords = Collections.unmodifiableList(new ArrayList<>(b.keywords));
        this.categories = Collections.unmodifiableSet(b.categories.isEmpty()
                ? EnumSet.noneOf(Category.class) : EnumSet.copyOf(b.categories));
        this.minRating = b.minRating;
        this.maxRating = b.maxRating;
        this.sentiment = b.sentiment;
        this.sortBy = b.sortBy;
        this.limit = b.limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static FilterQuery defaults() {
        return builder().build();
    }

    public List<String> getKeywords() { return keywords; }
    public Set<Category> getCategories() { return categories; }
    public double getMinRating() { return minRating; }
    public double getMaxRating() { return maxRating; }
    public Optional<Sentiment> getSentiment() { return Optional.ofNullable(sentiment); }
    public SortBy getSortBy() { return sortBy; }
    public int getLimit() { return limit; }

    @Override
    public String toString() {
        return "FilterQuery{keywords=" + keywords + ", categories=" + categories
                + ", rating=[" + minRating + ", " + maxRating + "], sentiment=" + sentiment
                + ", sortBy=" + sortBy + ", limit=" + limit + "}";
    }

    public static final class Builder {
        private final List<String> keywords = new ArrayList<>();
        private final Set<Category> categories = EnumSet.noneOf(Category.class);
        private double minRating = DEFAULT_MIN_RATING;
        private double maxRating = DEFAULT_MAX_RATING;
        private Sentiment sentiment;
        private SortBy sortBy = SortBy.RELEVANCE;
        private int limit = DEFAULT_LIMIT;

        private Builder() {}

        public Builder keywords(Collection<String> keywords) {
            this.keywords.clear();
            this.keywords.addAll(keywords);
            return this;
        }

        public Builder keywords(String... keywords) {
            return keywords(List.of(keywords));
        }

        public Builder categories(Collection<Category> categories) {
            this.categories.clear();
            this.categories.addAll(categories);
            return this;
        }

        public Builder categories(Category... categories) {
            return categories(List.of(categories));
        }

        public Builder minRating(double minRating) {
            this.minRating = minRating;
            return this;
        }

        public Builder maxRating(double maxRating) {
            this.maxRating = maxRating;
            return this;
        }

        public Builder sentiment(Sentiment sentiment) {
            this.sentiment = sentiment;
            return this;
        }

        public Builder sortBy(SortBy sortBy) {
            this.sortBy = sortBy == null ? SortBy.RELEVANCE : sortBy;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public FilterQuery build() {
            return new FilterQuery(this);
        }
    }
}
