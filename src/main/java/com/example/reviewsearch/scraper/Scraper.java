package com.example.reviewsearch.scraper;

import com.example.reviewsearch.error.ReviewSearchException;
import com.example.reviewsearch.model.Review;

import java.util.List;

public interface Scraper {
    /**
     * Scrape reviews from `url`. `platform` overrides detection when not null.
     */
    List<Review> scrape(String url, String platform) throws ReviewSearchException;
}
