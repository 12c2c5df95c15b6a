package com.example.reviewsearch.cli;

import com.example.reviewsearch.ReviewSearchService;
import com.example.reviewsearch.analysis.InsightAggregator;
import com.example.reviewsearch.error.FetchException;
import com.example.reviewsearch.error.InvalidQueryException;
import com.example.reviewsearch.error.UnsupportedPlatformException;
import com.example.reviewsearch.model.FilterQuery;
import com.example.reviewsearch.model.PlatformInfo;
import com.example.reviewsearch.model.ScrapeResult;
import com.example.reviewsearch.model.SearchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.example.reviewsearch.Fixtures.WALMART_URL;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AppTest {

    @Mock
    private ReviewSearchService service;

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private App app;

    @BeforeEach
    void setUp() {
        app = new App(() -> service,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() { return out.toString(StandardCharsets.UTF_8); }
    private String err() { return err.toString(StandardCharsets.UTF_8); }

    @Test
    void noArguments_printsUsage() {
        assertThat(app.run(new String[0])).isEqualTo(App.USAGE_ERROR);
        assertThat(out()).contains("Usage:");
        verifyNoInteractions(service);
    }

    @Test
    void unknownCommand_isAUsageError() {
        assertThat(app.run(new String[]{"crawl"})).isEqualTo(App.USAGE_ERROR);
        assertThat(err()).contains("Unsupported command: crawl");
    }

    @Test
    void scrapeWithoutUrl_isAUsageError() {
        assertThat(app.run(new String[]{"scrape"})).isEqualTo(App.USAGE_ERROR);
        verifyNoInteractions(service);
    }

    @Test
    void platforms_printsJson() {
        when(service.platforms()).thenReturn(List.of(new PlatformInfo("walmart", "Walmart", "walmart.com")));

        assertThat(app.run(new String[]{"platforms"})).isEqualTo(App.OK);
        assertThat(out()).contains("\"platform\": \"walmart\"").contains("\"domain\": \"walmart.com\"");
    }

    @Test
    void scrape_writesResultFile() throws Exception {
        Path target = dir.resolve("scrape.json");
        when(service.scrape(WALMART_URL, "walmart"))
                .thenReturn(new ScrapeResult(List.of(), "walmart", "2024-05-01T10:00:00Z", WALMART_URL));

        int code = app.run(new String[]{"scrape", WALMART_URL, "walmart", "out=" + target});

        assertThat(code).isEqualTo(App.OK);
        assertThat(out()).contains("Collected 0 reviews.").contains("Wrote ");
        assertThat(Files.readString(target)).contains("\"total_reviews\": 0").contains("\"platform\": \"walmart\"");
    }

    @Test
    void search_passesParametersAndWritesResult() throws Exception {
        Path target = dir.resolve("search.json");
        SearchResult result = new SearchResult(List.of(), new InsightAggregator().summarize(List.of()),
                FilterQuery.defaults(), 3, "walmart", "2024-05-01T10:00:00Z", WALMART_URL);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> params = ArgumentCaptor.forClass(Map.class);
        when(service.search(eq(WALMART_URL), params.capture())).thenReturn(result);

        int code = app.run(new String[]{"search", WALMART_URL, "keywords=assembly,setup", "Limit=5", "out=" + target});

        assertThat(code).isEqualTo(App.OK);
        assertThat(params.getValue())
                .containsOnly(entry("keywords", "assembly,setup"), entry("limit", "5"));
        assertThat(out()).contains("Found 0 relevant reviews out of 3 total.");
        assertThat(Files.readString(target)).contains("\"total_scraped\": 3").contains("\"filter_applied\"");
    }

    @Test
    void invalidQuery_isAUsageError() throws Exception {
        when(service.search(eq(WALMART_URL), anyMap()))
                .thenThrow(new InvalidQueryException("limit", "limit must not be negative; got -1"));

        assertThat(app.run(new String[]{"search", WALMART_URL, "limit=-1"})).isEqualTo(App.USAGE_ERROR);
        assertThat(err()).contains("Invalid limit: limit must not be negative");
    }

    @Test
    void unsupportedPlatform_fails() throws Exception {
        when(service.scrape("https://www.example.org/x", null))
                .thenThrow(new UnsupportedPlatformException("Unsupported platform for https://www.example.org/x",
                        List.of("amazon")));

        assertThat(app.run(new String[]{"scrape", "https://www.example.org/x"})).isEqualTo(App.FAILED);
        assertThat(err()).contains("Unsupported platform");
    }

    @Test
    void fetchFailure_fails() throws Exception {
        when(service.scrape(WALMART_URL, null)).thenThrow(new FetchException(WALMART_URL, "HTTP 503", null));

        assertThat(app.run(new String[]{"scrape", WALMART_URL})).isEqualTo(App.FAILED);
        assertThat(err()).contains("Error: HTTP 503");
    }

    @Test
    void options_keepsOnlyKeyValuePairs() {
        Map<String, String> options = App.options(new String[]{"search", "url", "bare", "=x", "Sort_By=rating", "k="}, 2);

        assertThat(options).containsOnly(entry("sort_by", "rating"), entry("k", ""));
    }
}
