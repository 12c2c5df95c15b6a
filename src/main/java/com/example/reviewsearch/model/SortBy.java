package com.example.reviewsearch.model;

import com.google.gson.annotations.SerializedName;

import java.util.Locale;

/**
 * Result ordering. {@link #INPUT_ORDER} keeps reviews in page order and is what an
 * unrecognized sort key resolves to.
 */
public enum SortBy {
    @SerializedName("relevance") RELEVANCE,
    @SerializedName("rating") RATING,
    @SerializedName("date") DATE,
    @SerializedName("length") LENGTH,
    @SerializedName("input_order") INPUT_ORDER;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SortBy fromKey(String key) {
        if (key == null || key.isBlank()) return RELEVANCE;
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (SortBy s : values()) {
            if (s.key().equals(k)) return s;
        }
        return INPUT_ORDER;
    }
}
