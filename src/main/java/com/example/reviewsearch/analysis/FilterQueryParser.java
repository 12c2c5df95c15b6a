package com.example.reviewsearch.analysis;

import com.example.reviewsearch.error.InvalidQueryException;
import com.example.reviewsearch.model.Category;
import com.example.reviewsearch.model.FilterQuery;
import com.example.reviewsearch.model.Sentiment;
import com.example.reviewsearch.model.SortBy;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link FilterQuery} from string parameters (keywords, categories, min_rating,
 * max_rating, sentiment, sort_by, limit). Anything that cannot be applied is rejected
 * instead of silently replaced by a default.
 */
public final class FilterQueryParser {

    public static final String KEYWORDS = "keywords";
    public static final String CATEGORIES = "categories";
    public static final String MIN_RATING = "min_rating";
    public static final String MAX_RATING = "max_rating";
    public static final String SENTIMENT = "sentiment";
    public static final String SORT_BY = "sort_by";
    public static final String LIMIT = "limit";

    private FilterQueryParser() {}

    public static FilterQuery parse(Map<String, String> params) throws InvalidQueryException {
        FilterQuery.Builder b = FilterQuery.builder();

        b.keywords(splitList(params.get(KEYWORDS)));

        Set<Category> categories = EnumSet.noneOf(Category.class);
        for (String key : splitList(params.get(CATEGORIES))) {
            Category c = Category.fromKey(key).orElseThrow(() -> new InvalidQueryException(CATEGORIES,
                    "Unknown category '" + key + "'"));
            categories.add(c);
        }
        b.categories(categories);

        double min = parseRating(params.get(MIN_RATING), MIN_RATING, FilterQuery.DEFAULT_MIN_RATING);
        double max = parseRating(params.get(MAX_RATING), MAX_RATING, FilterQuery.DEFAULT_MAX_RATING);
        if (min > max) {
            throw new InvalidQueryException(MIN_RATING, "min_rating (" + min + ") is greater than max_rating (" + max + ")");
        }
        b.minRating(min).maxRating(max);

        String sentiment = params.get(SENTIMENT);
        if (sentiment != null && !sentiment.isBlank()) {
            b.sentiment(Sentiment.fromKey(sentiment).orElseThrow(() -> new InvalidQueryException(SENTIMENT,
                    "sentiment must be one of positive, negative, neutral; got '" + sentiment + "'")));
        }

        b.sortBy(SortBy.fromKey(params.get(SORT_BY)));

        String limit = params.get(LIMIT);
        if (limit != null && !limit.isBlank()) {
            int n;
            try {
                n = Integer.parseInt(limit.trim());
            } catch (NumberFormatException e) {
                throw new InvalidQueryException(LIMIT, "limit must be an integer; got '" + limit + "'");
            }
            if (n < 0) {
                throw new InvalidQueryException(LIMIT, "limit must not be negative; got " + n);
            }
            b.limit(n);
        }

        return b.build();
    }

    static List<String> splitList(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) return out;
        for (String part : raw.split(",")) {
            String t = part.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static double parseRating(String raw, String name, double fallback) throws InvalidQueryException {
        if (raw == null || raw.isBlank()) return fallback;
        double v;
        try {
            v = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidQueryException(name, name + " must be a number; got '" + raw + "'");
        }
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            throw new InvalidQueryException(name, name + " must be a finite number; got '" + raw + "'");
        }
        return v;
    }
}
