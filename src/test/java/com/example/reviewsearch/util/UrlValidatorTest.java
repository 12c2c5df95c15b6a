package com.example.reviewsearch.util;

import com.example.reviewsearch.error.InvalidQueryException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class UrlValidatorTest {

    @Test
    void acceptsHttpAndHttps() throws Exception {
        assertThat(UrlValidator.validate("https://www.walmart.com/ip/desk/1?x=y")).isEqualTo("www.walmart.com");
        assertThat(UrlValidator.validate("  http://Example.ORG/reviews ")).isEqualTo("example.org");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "https://www.walmart.com/ip/desk?athcpid=a|b",
            "https://www.walmart.com/search?q=standing desk",
            "https://www.walmart.com/ip/desk?promo=50%off",
            "https://www.walmart.com/ip/desk#reviews|top"})
    void acceptsLooseCharactersOutsideTheHost(String url) throws Exception {
        assertThat(UrlValidator.validate(url)).isEqualTo("www.walmart.com");
    }

    @Test
    void host_handlesUnderscoresPortsAndUserInfo() {
        assertThat(UrlValidator.host("https://my_shop.walmart.com/ip/desk")).contains("my_shop.walmart.com");
        assertThat(UrlValidator.host("https://user:pw@www.target.com:8443/p/chair")).contains("www.target.com");
        assertThat(UrlValidator.host("http://[::1]:8080/x")).contains("[::1]");
        assertThat(UrlValidator.host("https://www.walmart.com?x=1")).contains("www.walmart.com");
    }

    @Test
    void host_isEmptyWithoutSchemeOrHost() {
        assertThat(UrlValidator.host(null)).isEmpty();
        assertThat(UrlValidator.host("www.walmart.com/ip/1")).isEmpty();
        assertThat(UrlValidator.host("https:///ip/1")).isEmpty();
        assertThat(UrlValidator.host("http://[broken")).isEmpty();
        assertThat(UrlValidator.host("http://shop example.com/x")).isEmpty();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "ftp://www.walmart.com/x", "www.walmart.com/ip/1", "https://", "http:///reviews",
            "https://:8080/x"})
    void rejectsUnusableUrls(String url) {
        assertThatThrownBy(() -> UrlValidator.validate(url))
                .isInstanceOfSatisfying(InvalidQueryException.class,
                        ex -> assertThat(ex.getParameter()).isEqualTo("url"));
    }
}
