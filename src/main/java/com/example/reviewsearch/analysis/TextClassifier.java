package com.example.reviewsearch.analysis;

import com.example.reviewsearch.model.Category;
import com.example.reviewsearch.model.Sentiment;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexicon based sentiment and category tagging. Stateless.
 */
public class TextClassifier {

    private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    static final Set<String> POSITIVE_WORDS = Set.of(
            "excellent", "amazing", "great", "love", "perfect", "awesome",
            "fantastic", "wonderful", "brilliant", "outstanding", "superb",
            "recommend", "happy", "satisfied", "pleased", "impressed");

    static final Set<String> NEGATIVE_WORDS = Set.of(
            "terrible", "awful", "hate", "horrible", "worst", "bad",
            "disappointed", "poor", "useless", "waste", "regret",
            "broken", "defective", "faulty", "cheap", "flimsy");

    /**
     * Distinct positive words against distinct negative words; a tie is neutral.
     */
    public Sentiment sentiment(String text) {
        if (text == null || text.isEmpty()) {
            return Sentiment.NEUTRAL;
        }
        Set<String> words = words(text);
        int positive = 0;
        int negative = 0;
        for (String w : words) {
            if (POSITIVE_WORDS.contains(w)) positive++;
            if (NEGATIVE_WORDS.contains(w)) negative++;
        }
        if (positive > negative) return Sentiment.POSITIVE;
        if (negative > positive) return Sentiment.NEGATIVE;
        return Sentiment.NEUTRAL;
    }

    public Set<Category> categories(String text) {
        Set<Category> out = EnumSet.noneOf(Category.class);
        if (text == null || text.isEmpty()) {
            return out;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Category c : Category.values()) {
            for (String keyword : c.getKeywords()) {
                if (lower.contains(keyword)) {
                    out.add(c);
                    break;
                }
            }
        }
        return out;
    }

    static Set<String> words(String text) {
        Set<String> out = new HashSet<>();
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            out.add(m.group());
        }
        return out;
    }
}
