package com.example.reviewsearch.io;

import com.example.reviewsearch.model.AnnotatedReview;
import com.example.reviewsearch.model.Category;
import com.example.reviewsearch.model.Review;
import com.example.reviewsearch.model.ReviewView;
import com.example.reviewsearch.util.TextSanitizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the output views: sanitized text, ratings clamped to 0..5, a link line and stars.
 */
public class ReviewFormatter {

    static final double MAX_STARS = 5;

    public List<ReviewView> format(List<Review> reviews) {
        List<ReviewView> out = new ArrayList<>();
        for (Review r : reviews) {
            ReviewView v = view(r);
            if (hasContent(v)) out.add(v);
        }
        return out;
    }

    public List<ReviewView> formatAnnotated(List<AnnotatedReview> reviews) {
        List<ReviewView> out = new ArrayList<>();
        for (AnnotatedReview a : reviews) {
            // already filtered, so every entry is kept to match the insights
            ReviewView v = view(a.getReview());
            v.setSentiment(a.getSentiment());
            List<String> categories = new ArrayList<>();
            for (Category c : a.getCategories()) categories.add(c.key());
            v.setCategories(categories);
            v.setKeywordRelevance(a.getKeywordRelevance());
            v.setRelevancePercentage(a.getRelevancePercentage());
            out.add(v);
        }
        return out;
    }

    ReviewView view(Review r) {
        ReviewView v = new ReviewView();
        String name = TextSanitizer.sanitize(r.getReviewerName());
        v.setReviewerName(name.isEmpty() ? "Anonymous" : name);
        v.setRating(clamp(r.getRating()));
        v.setReviewText(TextSanitizer.sanitize(r.getReviewText()));
        v.setDate(TextSanitizer.sanitize(r.getDate()));
        String url = r.getSourceUrl() == null ? "" : r.getSourceUrl();
        v.setReviewUrl(url);
        v.setReviewLink(reviewLink(r.getPlatformName(), url));
        v.setSource(r.getSource() == null ? "unknown" : r.getSource());
        v.setPlatform(r.getPlatformName() != null ? r.getPlatformName() : v.getSource());
        v.setStarDisplay(stars(v.getRating()));
        return v;
    }

    static String reviewLink(String platformName, String url) {
        if (platformName == null || platformName.isBlank()) {
            return "View Review: " + url;
        }
        return "View on " + platformName + ": " + url;
    }

    static String stars(double rating) {
        int full = (int) rating;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < MAX_STARS; i++) {
            sb.append(i < full ? '★' : '☆');
        }
        return sb.append(String.format(Locale.ROOT, " (%.1f/5)", rating)).toString();
    }

    private static double clamp(double rating) {
        return Math.max(0, Math.min(MAX_STARS, rating));
    }

    private static boolean hasContent(ReviewView v) {
        return !v.getReviewText().isEmpty() || v.getRating() > 0;
    }
}
