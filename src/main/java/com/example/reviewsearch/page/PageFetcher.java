package com.example.reviewsearch.page;

import com.example.reviewsearch.error.FetchException;

public interface PageFetcher {
    /**
     * Download and parse `url`. Network and HTTP errors surface as {@link FetchException}.
     */
    PageNode fetch(String url) throws FetchException;
}
