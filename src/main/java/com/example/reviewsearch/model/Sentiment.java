package com.example.reviewsearch.model;

import com.google.gson.annotations.SerializedName;

import java.util.Locale;
import java.util.Optional;

public enum Sentiment {
    @SerializedName("positive") POSITIVE,
    @SerializedName("negative") NEGATIVE,
    @SerializedName("neutral") NEUTRAL;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Sentiment> fromKey(String key) {
        if (key == null) return Optional.empty();
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (Sentiment s : values()) {
            if (s.key().equals(k)) return Optional.of(s);
        }
        return Optional.empty();
    }
}
