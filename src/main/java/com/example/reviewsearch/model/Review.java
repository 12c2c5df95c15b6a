package com.example.reviewsearch.model;

/**
 * Review model produced by the extractor for every supported platform.
 */
public class Review {
    private String reviewerName = "Anonymous";
    private double rating;
    private String reviewText = "";
    private String date = "";       // raw string as shown on the page
    private String sourceUrl;
    private String source;          // "<platformId>_scraping"
    private String platformName;

    // getters / setters
    public String getReviewerName() { return reviewerName; }
    public void setReviewerName(String reviewerName) { this.reviewerName = reviewerName; }

    public double getRating() { return rating; }
    public void setRating(double rating) { this.rating = rating; }

    public String getReviewText() { return reviewText; }
    public void setReviewText(String reviewText) { this.reviewText = reviewText; }

    public String getDate() { return date; }
    public void setDate(String date) { this.date = date; }

    public String getSourceUrl() { return sourceUrl; }
    public void setSourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public String getPlatformName() { return platformName; }
    public void setPlatformName(String platformName) { this.platformName = platformName; }

    /**
     * True when the review carries either text or a rating.
     */
    public boolean hasContent() {
        return (reviewText != null && !reviewText.isEmpty()) || rating != 0;
    }
}
