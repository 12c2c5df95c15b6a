package com.example.reviewsearch.error;

/**
 * Network or HTTP level failure while loading a review page. Never retried here.
 */
public class FetchException extends ReviewSearchException {

    private final String url;

    public FetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() { return url; }
}
