package com.example.reviewsearch.error;

/**
 * Base type for failures that abort a whole scrape or search call.
 */
public class ReviewSearchException extends Exception {

    public ReviewSearchException(String message) {
        super(message);
    }

    public ReviewSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
