package com.example.reviewsearch.scraper;

import com.example.reviewsearch.error.MalformedElementException;
import com.example.reviewsearch.model.Review;
import com.example.reviewsearch.model.SiteConfig;
import com.example.reviewsearch.page.PageNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns review containers into {@link Review}s using nothing but the selectors of a
 * {@link SiteConfig}. There is no per-platform code here.
 */
public class ReviewExtractor {

    private static final Logger log = LoggerFactory.getLogger(ReviewExtractor.class);

    static final String RATING_LABEL_ATTR = "aria-label";
    static final String DATE_ATTR = "datetime";
    static final String DEFAULT_REVIEWER = "Anonymous";

    private static final Pattern NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)");

    public List<Review> extract(PageNode document, SiteConfig config, String platformId, String sourceUrl) {
        List<PageNode> containers = document.selectAll(config.getReviewContainer());
        int limit = Math.min(containers.size(), config.getMaxReviews());
        log.debug("{}: {} review containers matched, reading {}", config.getName(), containers.size(), limit);

        List<Review> out = new ArrayList<>();
        for (int i = 0; i < limit; i++) {
            try {
                Review r = readContainer(containers.get(i), config, i);
                if (!r.hasContent()) {
                    continue;
                }
                r.setSourceUrl(sourceUrl);
                r.setSource(platformId + "_scraping");
                r.setPlatformName(config.getName());
                out.add(r);
            } catch (MalformedElementException ex) {
                log.warn("{}: skipping container #{} of {}: {}", config.getName(), ex.getContainerIndex(),
                        sourceUrl, ex.getCause().getMessage());
            }
        }
        return out;
    }

    private Review readContainer(PageNode container, SiteConfig config, int index) {
        try {
            Review r = new Review();

            // reviewer
            container.selectFirst(config.getReviewerName())
                    .map(PageNode::text)
                    .filter(t -> !t.isEmpty())
                    .ifPresent(r::setReviewerName);

            // rating: accessible label first, then text
            container.selectFirst(config.getRating())
                    .map(ReviewExtractor::ratingSource)
                    .flatMap(ReviewExtractor::parseRating)
                    .ifPresent(v -> r.setRating(normalize(v, config.getRatingScale())));

            // body
            container.selectFirst(config.getReviewText())
                    .map(PageNode::text)
                    .ifPresent(r::setReviewText);

            // date: machine-readable attribute first, then text
            container.selectFirst(config.getDate())
                    .map(ReviewExtractor::dateSource)
                    .ifPresent(r::setDate);

            return r;
        } catch (RuntimeException ex) {
            throw new MalformedElementException(index, ex);
        }
    }

    private static String ratingSource(PageNode el) {
        Optional<String> label = el.attr(RATING_LABEL_ATTR).filter(s -> !s.isBlank());
        return label.orElseGet(el::text);
    }

    private static String dateSource(PageNode el) {
        Optional<String> attr = el.attr(DATE_ATTR).map(String::trim).filter(s -> !s.isEmpty());
        return attr.orElseGet(() -> el.text().trim());
    }

    /**
     * First decimal number in the text, if any.
     */
    static Optional<Double> parseRating(String text) {
        if (text == null) return Optional.empty();
        Matcher m = NUMBER.matcher(text);
        if (!m.find()) return Optional.empty();
        try {
            return Optional.of(Double.parseDouble(m.group(1)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    // ratings are reported on a five point scale
    private static double normalize(double value, int scale) {
        if (scale == 5) return value;
        return value * 5.0 / scale;
    }
}
