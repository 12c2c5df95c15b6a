package com.example.reviewsearch;

import com.example.reviewsearch.model.AnnotatedReview;
import com.example.reviewsearch.model.Category;
import com.example.reviewsearch.model.Review;
import com.example.reviewsearch.model.Sentiment;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.EnumSet;

/**
 * Shared test data.
 */
public final class Fixtures {

    public static final String WALMART_URL = "https://www.walmart.com/ip/standing-desk/123456";

    private Fixtures() {}

    public static String html(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/pages/" + name)) {
            if (in == null) throw new IllegalArgumentException("missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Review review(String text, double rating) {
        return review(text, rating, "");
    }

    public static Review review(String text, double rating, String date) {
        Review r = new Review();
        r.setReviewText(text);
        r.setRating(rating);
        r.setDate(date);
        r.setSourceUrl(WALMART_URL);
        r.setSource("walmart_scraping");
        r.setPlatformName("Walmart");
        return r;
    }

    public static AnnotatedReview annotated(double rating, Sentiment sentiment, Category... categories) {
        EnumSet<Category> set = EnumSet.noneOf(Category.class);
        set.addAll(Arrays.asList(categories));
        return new AnnotatedReview(review("text", rating), sentiment, set, 1.0, false);
    }
}
