package com.example.reviewsearch.analysis;

import com.example.reviewsearch.model.AnnotatedReview;
import com.example.reviewsearch.model.Category;
import com.example.reviewsearch.model.FilterQuery;
import com.example.reviewsearch.model.Review;
import com.example.reviewsearch.model.Sentiment;
import com.example.reviewsearch.model.SortBy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Filters, annotates, sorts and truncates reviews for a {@link FilterQuery}.
 * <p>
 * A review is kept only when every check passes: rating range, sentiment, category overlap
 * and, for keyword queries, a relevance above {@link #RELEVANCE_THRESHOLD}. Sorting is stable,
 * so ties keep page order.
 */
public class ReviewFilterRanker {

    private static final Logger log = LoggerFactory.getLogger(ReviewFilterRanker.class);

    public static final double RELEVANCE_THRESHOLD = 0.10;

    private final TextClassifier classifier;
    private final RelevanceScorer scorer;

    public ReviewFilterRanker() {
        this(new TextClassifier(), new RelevanceScorer());
    }

    public ReviewFilterRanker(TextClassifier classifier, RelevanceScorer scorer) {
        this.classifier = classifier;
        this.scorer = scorer;
    }

    public List<AnnotatedReview> apply(List<Review> reviews, FilterQuery query) {
        if (reviews == null || reviews.isEmpty()) {
            return Collections.emptyList();
        }
        boolean keywordQuery = !query.getKeywords().isEmpty();
        Optional<Sentiment> wanted = query.getSentiment();

        List<AnnotatedReview> kept = new ArrayList<>();
        for (Review review : reviews) {
            double rating = review.getRating();
            if (rating < query.getMinRating() || rating > query.getMaxRating()) {
                continue;
            }

            String text = review.getReviewText() == null ? "" : review.getReviewText();
            Sentiment sentiment = classifier.sentiment(text);
            if (wanted.isPresent() && wanted.get() != sentiment) {
                continue;
            }

            Set<Category> categories = classifier.categories(text);
            if (!query.getCategories().isEmpty() && Collections.disjoint(categories, query.getCategories())) {
                continue;
            }

            double relevance = 1.0;
            if (keywordQuery) {
                relevance = scorer.relevance(text, query.getKeywords());
                if (relevance <= RELEVANCE_THRESHOLD) {
                    continue;
                }
            }

            kept.add(new AnnotatedReview(review, sentiment, categories, relevance, keywordQuery));
        }

        sort(kept, query.getSortBy());
        int limit = Math.max(0, query.getLimit());
        List<AnnotatedReview> out = kept.size() > limit ? new ArrayList<>(kept.subList(0, limit)) : kept;

        log.debug("Filter kept {} of {} reviews ({} returned) for {}", kept.size(), reviews.size(), out.size(), query);
        return out;
    }

    static void sort(List<AnnotatedReview> reviews, SortBy sortBy) {
        Comparator<AnnotatedReview> order = comparator(sortBy);
        if (order != null) {
            reviews.sort(order);
        }
    }

    /**
     * Descending order for the key, or null to keep input order.
     */
    static Comparator<AnnotatedReview> comparator(SortBy sortBy) {
        switch (sortBy) {
            case RELEVANCE:
                return Comparator.comparingDouble(AnnotatedReview::getKeywordRelevance).reversed();
            case RATING:
                return Comparator.comparingDouble(AnnotatedReview::getRating).reversed();
            case DATE:
                // raw strings, so this is only approximately chronological
                return Comparator.comparing(AnnotatedReview::getDate).reversed();
            case LENGTH:
                return Comparator.comparingInt((AnnotatedReview r) -> r.getReviewText().length()).reversed();
            default:
                return null;
        }
    }
}
