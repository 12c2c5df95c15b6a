package com.example.reviewsearch;

import com.example.reviewsearch.analysis.InsightAggregator;
import com.example.reviewsearch.analysis.ReviewFilterRanker;
import com.example.reviewsearch.error.FetchException;
import com.example.reviewsearch.error.InvalidQueryException;
import com.example.reviewsearch.error.UnsupportedPlatformException;
import com.example.reviewsearch.io.ReviewFormatter;
import com.example.reviewsearch.model.CategoryInfo;
import com.example.reviewsearch.model.FilterQuery;
import com.example.reviewsearch.model.ReviewView;
import com.example.reviewsearch.model.ScrapeResult;
import com.example.reviewsearch.model.SearchResult;
import com.example.reviewsearch.model.Sentiment;
import com.example.reviewsearch.page.JsoupPageNode;
import com.example.reviewsearch.page.PageFetcher;
import com.example.reviewsearch.scraper.SiteRegistry;
import com.example.reviewsearch.scraper.UniversalScraper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.example.reviewsearch.Fixtures.WALMART_URL;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReviewSearchServiceTest {

    private static final String NOW = "2024-05-01T10:00:00Z";

    @Mock
    private PageFetcher fetcher;

    private ReviewSearchService service;

    @BeforeEach
    void setUp() {
        service = new ReviewSearchService(
                new UniversalScraper(SiteRegistry.fromDefaultConfig(), fetcher),
                new ReviewFilterRanker(), new InsightAggregator(), new ReviewFormatter(),
                Clock.fixed(Instant.parse(NOW), ZoneOffset.UTC));
    }

    private void servePage() throws FetchException {
        when(fetcher.fetch(WALMART_URL))
                .thenReturn(JsoupPageNode.parse(Fixtures.html("walmart_reviews.html"), WALMART_URL));
    }

    @Test
    void scrape_returnsEveryFormattedReview() throws Exception {
        servePage();

        ScrapeResult result = service.scrape(WALMART_URL, null);

        assertThat(result.getTotalReviews()).isEqualTo(3);
        assertThat(result.getPlatform()).isEqualTo("walmart");
        assertThat(result.getScrapedAt()).isEqualTo(NOW);
        assertThat(result.getOriginalUrl()).isEqualTo(WALMART_URL);
        assertThat(result.getReviews()).extracting(ReviewView::getReviewerName)
                .containsExactly("Dana K.", "Anonymous", "Lee");
        assertThat(result.getReviews().get(0).getStarDisplay()).isEqualTo("★★★★☆ (4.5/5)");
    }

    @Test
    void search_keywordMatchesOneReview() throws Exception {
        servePage();

        SearchResult result = service.search(WALMART_URL, Map.of("keywords", "assembly"));

        assertThat(result.getTotalFound()).isEqualTo(1);
        assertThat(result.getTotalScraped()).isEqualTo(3);
        assertThat(result.summary()).isEqualTo("Found 1 relevant reviews out of 3 total");
        ReviewView hit = result.getReviews().get(0);
        assertThat(hit.getReviewerName()).isEqualTo("Dana K.");
        assertThat(hit.getSentiment()).isEqualTo(Sentiment.POSITIVE);
        assertThat(hit.getCategories()).containsExactly("assembly");
        assertThat(hit.getRelevancePercentage()).isEqualTo("100.0%");
        assertThat(result.getInsights().getTotalReviews()).isEqualTo(1);
        assertThat(result.getInsights().getAverageRating()).isEqualTo(4.5);
        assertThat(result.getInsights().getRatingDistribution()).containsEntry("5_star", 1);
        assertThat(result.getFilterApplied().getKeywords()).containsExactly("assembly");
    }

    @Test
    void search_withoutFilters_keepsPageOrder() throws Exception {
        servePage();

        SearchResult result = service.search(WALMART_URL, FilterQuery.defaults());

        assertThat(result.getTotalFound()).isEqualTo(3);
        assertThat(result.getReviews()).extracting(ReviewView::getRelevancePercentage).containsOnly("100%");
        assertThat(result.getReviews()).extracting(ReviewView::getRating).containsExactly(4.5, 2.0, 5.0);
        assertThat(result.getInsights().getSentimentBreakdown())
                .containsEntry("positive", 1).containsEntry("neutral", 2);
    }

    @Test
    void scrape_trackingUrlWithPipeInQuery_isDetected() throws Exception {
        String url = "https://www.walmart.com/ip/standing-desk/123456?athcpid=123|456&from=/search";
        when(fetcher.fetch(url)).thenReturn(JsoupPageNode.parse(Fixtures.html("walmart_reviews.html"), url));

        ScrapeResult result = service.scrape(url, null);

        assertThat(result.getPlatform()).isEqualTo("walmart");
        assertThat(result.getTotalReviews()).isEqualTo(3);
    }

    @Test
    void search_unknownHost_failsWithoutFetching() {
        assertThatThrownBy(() -> service.search("https://shop.example.org/item/1", Map.of()))
                .isInstanceOf(UnsupportedPlatformException.class);
        verifyNoInteractions(fetcher);
    }

    @Test
    void search_badParameters_failBeforeFetching() {
        assertThatThrownBy(() -> service.search(WALMART_URL, Map.of("min_rating", "6")))
                .isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> service.search("ftp://www.walmart.com/ip/1", Map.of()))
                .isInstanceOfSatisfying(InvalidQueryException.class,
                        ex -> assertThat(ex.getParameter()).isEqualTo("url"));
        assertThatThrownBy(() -> service.search(WALMART_URL, (FilterQuery) null))
                .isInstanceOf(InvalidQueryException.class);
        verifyNoInteractions(fetcher);
    }

    @Test
    void fetchFailure_propagates() throws Exception {
        when(fetcher.fetch(WALMART_URL)).thenThrow(new FetchException(WALMART_URL, "HTTP 503", null));

        assertThatThrownBy(() -> service.scrape(WALMART_URL, null))
                .isInstanceOfSatisfying(FetchException.class,
                        ex -> assertThat(ex.getUrl()).isEqualTo(WALMART_URL));
    }

    @Test
    void scrape_unknownPlatformOverride_isRejected() {
        assertThatThrownBy(() -> service.scrape(WALMART_URL, "ebay-motors"))
                .isInstanceOf(UnsupportedPlatformException.class);
        verifyNoInteractions(fetcher);
    }

    @Test
    void catalogues() {
        assertThat(service.platforms()).hasSize(46);

        List<CategoryInfo> categories = service.categories();
        assertThat(categories).hasSize(8);
        assertThat(categories.get(0).getCategory()).isEqualTo("assembly");
        assertThat(categories.get(0).getKeywords())
                .containsExactly("assembly", "setup", "installation", "instructions");
        assertThat(categories.get(6).getKeywords())
                .containsExactly("customer service", "support", "help", "staff");
        assertThat(categories).allSatisfy(c -> assertThat(c.getKeywords()).hasSize(4));
    }
}
