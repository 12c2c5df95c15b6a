package com.example.reviewsearch.analysis;

import com.example.reviewsearch.model.AnnotatedReview;
import com.example.reviewsearch.model.Category;
import com.example.reviewsearch.model.Insights;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts, averages and a five bucket rating histogram over a filtered review set.
 */
public class InsightAggregator {

    static final int TOP_CATEGORIES = 5;

    public Insights summarize(List<AnnotatedReview> reviews) {
        if (reviews == null || reviews.isEmpty()) {
            return new Insights(0, 0.0, Collections.emptyMap(), Collections.emptyMap(),
                    Collections.emptyList(), ratingDistribution(Collections.emptyList()));
        }

        Map<String, Integer> categoryCounts = new LinkedHashMap<>();
        Map<String, Integer> sentimentCounts = new LinkedHashMap<>();
        List<Double> ratings = new ArrayList<>(reviews.size());
        double sum = 0;

        for (AnnotatedReview r : reviews) {
            for (Category c : r.getCategories()) {
                categoryCounts.merge(c.key(), 1, Integer::sum);
            }
            sentimentCounts.merge(r.getSentiment().key(), 1, Integer::sum);
            ratings.add(r.getRating());
            sum += r.getRating();
        }

        Map<String, Integer> categoryBreakdown = byCountDescending(categoryCounts);
        List<String> top = new ArrayList<>(categoryBreakdown.keySet());
        if (top.size() > TOP_CATEGORIES) {
            top = top.subList(0, TOP_CATEGORIES);
        }

        return new Insights(reviews.size(), sum / reviews.size(), categoryBreakdown, sentimentCounts,
                top, ratingDistribution(ratings));
    }

    // stable: equal counts stay in first-seen order
    private static Map<String, Integer> byCountDescending(Map<String, Integer> counts) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        Map<String, Integer> out = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> e : entries) {
            out.put(e.getKey(), e.getValue());
        }
        return out;
    }

    static Map<String, Integer> ratingDistribution(List<Double> ratings) {
        int five = 0, four = 0, three = 0, two = 0, one = 0;
        for (double r : ratings) {
            if (r >= 4.5) five++;
            else if (r >= 3.5) four++;
            else if (r >= 2.5) three++;
            else if (r >= 1.5) two++;
            else one++;
        }
        Map<String, Integer> out = new LinkedHashMap<>();
        out.put("5_star", five);
        out.put("4_star", four);
        out.put("3_star", three);
        out.put("2_star", two);
        out.put("1_star", one);
        return out;
    }
}
