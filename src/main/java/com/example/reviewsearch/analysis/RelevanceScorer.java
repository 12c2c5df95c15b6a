package com.example.reviewsearch.analysis;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword density score in [0, 1]. A whole-word hit counts 2, a hit inside a longer word
 * counts 1, and the sum is divided by twice the number of keywords.
 */
public class RelevanceScorer {

    public double relevance(String text, List<String> keywords) {
        if (text == null || text.isBlank() || keywords == null || keywords.isEmpty()) {
            return 0.0;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        int total = 0;
        for (String keyword : keywords) {
            if (keyword == null || keyword.isEmpty()) continue;
            String k = keyword.toLowerCase(Locale.ROOT);
            int exact = countWholeWord(lower, k);
            int partial = Math.max(0, countOccurrences(lower, k) - exact);
            total += exact * 2 + partial;
        }
        return Math.min(total / (2.0 * keywords.size()), 1.0);
    }

    static int countWholeWord(String text, String keyword) {
        Pattern p = Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", Pattern.UNICODE_CHARACTER_CLASS);
        Matcher m = p.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    // non-overlapping, left to right
    static int countOccurrences(String text, String keyword) {
        int n = 0;
        int from = 0;
        while (true) {
            int idx = text.indexOf(keyword, from);
            if (idx < 0) return n;
            n++;
            from = idx + keyword.length();
        }
    }
}
