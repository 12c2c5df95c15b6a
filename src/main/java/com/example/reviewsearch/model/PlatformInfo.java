package com.example.reviewsearch.model;

/**
 * Listing entry for a supported platform.
 */
public class PlatformInfo {
    private final String platform;
    private final String name;
    private final String domain;

    public PlatformInfo(String platform, String name, String domain) {
        this.platform = platform;
        this.name = name;
        this.domain = domain;
    }

    public String getPlatform() { return platform; }
    public String getName() { return name; }
    public String getDomain() { return domain; }
}
