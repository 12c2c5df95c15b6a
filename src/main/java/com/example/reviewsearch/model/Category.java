package com.example.reviewsearch.model;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Review topics with the keyword lexicon used to detect them. A keyword matches when it
 * appears anywhere in the lower-cased review text.
 */
public enum Category {

    @SerializedName("assembly")
    ASSEMBLY("Reviews about product assembly, setup, and installation", List.of(
            "assembly", "assemble", "put together", "setup", "installation",
            "install", "build", "construction", "instructions", "manual",
            "easy to assemble", "hard to assemble", "difficult assembly"),
            List.of("assembly", "setup", "installation", "instructions")),

    @SerializedName("quality")
    QUALITY("Reviews about build quality, materials, and construction", List.of(
            "quality", "build quality", "material", "sturdy", "durable",
            "solid", "cheap", "flimsy", "well made", "construction",
            "materials", "finish", "craftsmanship"),
            List.of("quality", "build quality", "material", "sturdy")),

    @SerializedName("value")
    VALUE("Reviews about price, value for money, and cost", List.of(
            "value", "price", "worth", "expensive", "cheap", "affordable",
            "money", "cost", "budget", "overpriced", "good deal",
            "bang for buck", "value for money"),
            List.of("value", "price", "worth", "affordable")),

    @SerializedName("size")
    SIZE("Reviews about product size, dimensions, and fit", List.of(
            "size", "big", "small", "large", "compact", "spacious",
            "dimensions", "fit", "space", "room", "tiny", "huge",
            "perfect size", "too big", "too small"),
            List.of("size", "big", "small", "dimensions")),

    @SerializedName("comfort")
    COMFORT("Reviews about comfort, ergonomics, and feel", List.of(
            "comfort", "comfortable", "ergonomic", "soft", "firm",
            "cushion", "support", "padding", "cozy", "uncomfortable"),
            List.of("comfort", "comfortable", "ergonomic", "soft")),

    @SerializedName("delivery")
    DELIVERY("Reviews about shipping, delivery, and packaging", List.of(
            "delivery", "shipping", "arrived", "package", "packaging",
            "fast shipping", "slow delivery", "damaged", "box",
            "delivered", "received"),
            List.of("delivery", "shipping", "packaging", "arrived")),

    @SerializedName("customer_service")
    CUSTOMER_SERVICE("Reviews about customer support and service", List.of(
            "customer service", "support", "help", "response", "staff",
            "representative", "helpful", "rude", "friendly", "contact"),
            List.of("customer service", "support", "help", "staff")),

    @SerializedName("durability")
    DURABILITY("Reviews about product longevity and durability", List.of(
            "durability", "durable", "last", "lasting", "wear", "tear",
            "broke", "broken", "sturdy", "reliable", "falls apart"),
            List.of("durability", "durable", "last", "reliable"));

    private final String description;
    private final List<String> keywords;
    private final List<String> sampleKeywords;

    Category(String description, List<String> keywords, List<String> sampleKeywords) {
        this.description = description;
        this.keywords = keywords;
        this.sampleKeywords = sampleKeywords;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getDescription() { return description; }

    public List<String> getKeywords() { return keywords; }

    /**
     * Short list shown in the category catalogue.
     */
    public List<String> getSampleKeywords() { return sampleKeywords; }

    public static Optional<Category> fromKey(String key) {
        if (key == null) return Optional.empty();
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (Category c : values()) {
            if (c.key().equals(k)) return Optional.of(c);
        }
        return Optional.empty();
    }
}
