package com.example.reviewsearch.error;

import java.util.List;

/**
 * No registry entry exists for the requested platform or URL host.
 */
public class UnsupportedPlatformException extends ReviewSearchException {

    private final List<String> supportedPlatforms;

    public UnsupportedPlatformException(String message, List<String> supportedPlatforms) {
        super(message);
        this.supportedPlatforms = List.copyOf(supportedPlatforms);
    }

    public List<String> getSupportedPlatforms() { return supportedPlatforms; }
}
