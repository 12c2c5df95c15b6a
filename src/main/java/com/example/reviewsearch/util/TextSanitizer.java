package com.example.reviewsearch.util;

/**
 * Cleans scraped text before it leaves the service.
 */
public final class TextSanitizer {

    public static final int MAX_LENGTH = 5000;

    private TextSanitizer() {}

    public static String sanitize(String text) {
        if (text == null) return "";
        String cleaned = text.trim().replaceAll("\\s+", " ");
        cleaned = cleaned.replaceAll("[<>\"'&]", "");
        if (cleaned.length() > MAX_LENGTH) {
            cleaned = cleaned.substring(0, MAX_LENGTH) + "...";
        }
        return cleaned.trim();
    }
}
