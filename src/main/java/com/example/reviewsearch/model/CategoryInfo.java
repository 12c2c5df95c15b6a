package com.example.reviewsearch.model;

import java.util.List;

/**
 * Catalogue entry describing a filterable category.
 */
public class CategoryInfo {
    private final String category;
    private final String description;
    private final List<String> keywords;

    public CategoryInfo(String category, String description, List<String> keywords) {
        this.category = category;
        this.description = description;
        this.keywords = List.copyOf(keywords);
    }

    public String getCategory() { return category; }
    public String getDescription() { return description; }
    public List<String> getKeywords() { return keywords; }
}
