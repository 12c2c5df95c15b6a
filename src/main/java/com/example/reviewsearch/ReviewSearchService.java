package com.example.reviewsearch;

import com.example.reviewsearch.analysis.FilterQueryParser;
import com.example.reviewsearch.analysis.InsightAggregator;
import com.example.reviewsearch.analysis.ReviewFilterRanker;
import com.example.reviewsearch.error.InvalidQueryException;
import com.example.reviewsearch.error.ReviewSearchException;
import com.example.reviewsearch.io.ReviewFormatter;
import com.example.reviewsearch.model.AnnotatedReview;
import com.example.reviewsearch.model.Category;
import com.example.reviewsearch.model.CategoryInfo;
import com.example.reviewsearch.model.FilterQuery;
import com.example.reviewsearch.model.Insights;
import com.example.reviewsearch.model.PlatformInfo;
import com.example.reviewsearch.model.Review;
import com.example.reviewsearch.model.ScrapeResult;
import com.example.reviewsearch.model.SearchResult;
import com.example.reviewsearch.model.ReviewView;
import com.example.reviewsearch.page.JsoupPageFetcher;
import com.example.reviewsearch.page.PageFetcher;
import com.example.reviewsearch.scraper.SiteRegistry;
import com.example.reviewsearch.scraper.UniversalScraper;
import com.example.reviewsearch.util.UrlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point for front ends: list platforms and categories, scrape a page, or search it.
 * <p>
 * Every call works on its own values; nothing is remembered between calls. Whole-call
 * failures (bad input, unknown platform, network) are thrown, so an empty result always
 * means "nothing matched".
 *
 * Usage:
 *   ReviewSearchService svc = ReviewSearchService.createDefault();
 *   SearchResult r = svc.search("https://www.walmart.com/ip/desk", Map.of("keywords", "assembly"));
 */
public class ReviewSearchService {

    private static final Logger log = LoggerFactory.getLogger(ReviewSearchService.class);

    private final UniversalScraper scraper;
    private final ReviewFilterRanker ranker;
    private final InsightAggregator aggregator;
    private final ReviewFormatter formatter;
    private final Clock clock;

    public ReviewSearchService(UniversalScraper scraper, ReviewFilterRanker ranker,
                               InsightAggregator aggregator, ReviewFormatter formatter, Clock clock) {
        this.scraper = scraper;
        this.ranker = ranker;
        this.aggregator = aggregator;
        this.formatter = formatter;
        this.clock = clock;
    }

    public ReviewSearchService(SiteRegistry registry, PageFetcher fetcher) {
        this(new UniversalScraper(registry, fetcher), new ReviewFilterRanker(), new InsightAggregator(),
                new ReviewFormatter(), Clock.systemUTC());
    }

    public static ReviewSearchService createDefault() {
        return new ReviewSearchService(SiteRegistry.fromDefaultConfig(), JsoupPageFetcher.fromDefaultConfig());
    }

    public List<PlatformInfo> platforms() {
        return scraper.getRegistry().list();
    }

    public List<CategoryInfo> categories() {
        List<CategoryInfo> out = new ArrayList<>();
        for (Category c : Category.values()) {
            out.add(new CategoryInfo(c.key(), c.getDescription(), c.getSampleKeywords()));
        }
        return out;
    }

    /**
     * Scrape every review on the page. `platform` may be null to detect it from the URL.
     */
    public ScrapeResult scrape(String url, String platform) throws ReviewSearchException {
        UrlValidator.validate(url);
        String platformId = scraper.resolvePlatform(url, platform);

        List<Review> reviews = scraper.scrape(url, platformId);
        List<ReviewView> views = formatter.format(reviews);

        log.info("Successfully scraped {} reviews from {}", views.size(), url);
        return new ScrapeResult(views, platformId, now(), url);
    }

    /**
     * Scrape the page, then filter, rank and summarize according to the string parameters
     * understood by {@link FilterQueryParser}.
     */
    public SearchResult search(String url, Map<String, String> params) throws ReviewSearchException {
        UrlValidator.validate(url);
        FilterQuery query = FilterQueryParser.parse(params);
        return search(url, query);
    }

    public SearchResult search(String url, FilterQuery query) throws ReviewSearchException {
        if (query == null) {
            throw new InvalidQueryException("query", "a filter query is required");
        }
        UrlValidator.validate(url);
        String platformId = scraper.resolvePlatform(url, null);

        List<Review> reviews = scraper.scrape(url, platformId);
        List<AnnotatedReview> ranked = ranker.apply(reviews, query);
        Insights insights = aggregator.summarize(ranked);
        List<ReviewView> views = formatter.formatAnnotated(ranked);

        SearchResult result = new SearchResult(views, insights, query, reviews.size(), platformId, now(), url);
        log.info("Search on {}: {}/{} reviews matched", platformId, result.getTotalFound(), result.getTotalScraped());
        return result;
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
