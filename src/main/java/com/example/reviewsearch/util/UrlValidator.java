package com.example.reviewsearch.util;

import com.example.reviewsearch.error.InvalidQueryException;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accepts absolute http(s) URLs that name a host.
 * <p>
 * The host is read from the authority alone, so characters that a strict URI parser
 * rejects in the path or query (spaces, '|', a bare '%') do not make a shop URL unusable.
 */
public final class UrlValidator {

    // scheme://authority, stopping at the first path, query or fragment delimiter
    private static final Pattern AUTHORITY = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*://([^/?#\\\\]*)");

    private UrlValidator() {}

    /**
     * @return the lower-cased host of the URL
     */
    public static String validate(String url) throws InvalidQueryException {
        if (url == null || url.isBlank()) {
            throw new InvalidQueryException("url", "URL must be a non-empty string");
        }
        String trimmed = url.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            throw new InvalidQueryException("url", "URL must start with http:// or https://");
        }
        return host(trimmed).orElseThrow(
                () -> new InvalidQueryException("url", "Invalid URL format - missing domain"));
    }

    /**
     * Host part of `scheme://[userinfo@]host[:port]/...`, lower-cased. Empty when the URL
     * has no scheme or no usable host.
     */
    public static Optional<String> host(String url) {
        if (url == null) return Optional.empty();
        Matcher m = AUTHORITY.matcher(url.trim());
        if (!m.find()) return Optional.empty();

        String authority = m.group(1);
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }

        String host;
        if (authority.startsWith("[")) {
            int end = authority.indexOf(']');
            if (end < 0) return Optional.empty();
            host = authority.substring(0, end + 1);
        } else {
            int colon = authority.indexOf(':');
            host = colon >= 0 ? authority.substring(0, colon) : authority;
        }

        if (host.isEmpty() || host.chars().anyMatch(Character::isWhitespace)) {
            return Optional.empty();
        }
        return Optional.of(host.toLowerCase(Locale.ROOT));
    }
}
