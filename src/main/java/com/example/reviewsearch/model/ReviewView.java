package com.example.reviewsearch.model;

import java.util.List;

/**
 * Output shape of a review: sanitized, clamped, with a display link and star string.
 * Annotation fields stay null for plain scrapes.
 */
public class ReviewView {
    private String reviewerName;
    private double rating;
    private String reviewText;
    private String date;
    private String reviewUrl;
    private String reviewLink;
    private String source;
    private String platform;
    private String starDisplay;

    private Sentiment sentiment;
    private List<String> categories;
    private Double keywordRelevance;
    private String relevancePercentage;

    public String getReviewerName() { return reviewerName; }
    public void setReviewerName(String reviewerName) { this.reviewerName = reviewerName; }

    public double getRating() { return rating; }
    public void setRating(double rating) { this.rating = rating; }

    public String getReviewText() { return reviewText; }
    public void setReviewText(String reviewText) { this.reviewText = reviewText; }

    public String getDate() { return date; }
    public void setDate(String date) { this.date = date; }

    public String getReviewUrl() { return reviewUrl; }
    public void setReviewUrl(String reviewUrl) { this.reviewUrl = reviewUrl; }

    public String getReviewLink() { return reviewLink; }
    public void setReviewLink(String reviewLink) { this.reviewLink = reviewLink; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public String getPlatform() { return platform; }
    public void setPlatform(String platform) { this.platform = platform; }

    public String getStarDisplay() { return starDisplay; }
    public void setStarDisplay(String starDisplay) { this.starDisplay = starDisplay; }

    public Sentiment getSentiment() { return sentiment; }
    public void setSentiment(Sentiment sentiment) { this.sentiment = sentiment; }

    public List<String> getCategories() { return categories; }
    public void setCategories(List<String> categories) { this.categories = categories; }

    public Double getKeywordRelevance() { return keywordRelevance; }
    public void setKeywordRelevance(Double keywordRelevance) { this.keywordRelevance = keywordRelevance; }

    public String getRelevancePercentage() { return relevancePercentage; }
    public void setRelevancePercentage(String relevancePercentage) { this.relevancePercentage = relevancePercentage; }
}
