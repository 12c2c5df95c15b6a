package com.example.reviewsearch.page;

import com.example.reviewsearch.error.FetchException;
import com.example.reviewsearch.util.JsonConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class JsoupPageFetcherTest {

    @Test
    void fromDefaultConfig_readsHeadersAndTimeout() {
        JsoupPageFetcher fetcher = JsoupPageFetcher.fromDefaultConfig();

        assertThat(fetcher.getTimeoutMs()).isEqualTo(10000);
        assertThat(fetcher.getHeaders()).containsKeys("User-Agent", "Accept", "Accept-Language");
    }

    @Test
    void fromConfig_appliesDefaults() {
        JsoupPageFetcher fetcher = JsoupPageFetcher.fromConfig(JsonConfig.parse("inline", "{}"));

        assertThat(fetcher.getTimeoutMs()).isEqualTo(JsoupPageFetcher.DEFAULT_TIMEOUT_MS);
        assertThat(fetcher.getHeaders()).isEmpty();
    }

    @Test
    void malformedUrl_becomesFetchException() {
        JsoupPageFetcher fetcher = new JsoupPageFetcher(1000, true, 0, Map.of());

        assertThatThrownBy(() -> fetcher.fetch("not a url"))
                .isInstanceOfSatisfying(FetchException.class,
                        ex -> assertThat(ex.getUrl()).isEqualTo("not a url"));
    }
}
