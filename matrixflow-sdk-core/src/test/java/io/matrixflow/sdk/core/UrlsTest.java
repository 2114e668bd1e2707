package io.matrixflow.sdk.core;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UrlsTest {

    @Test
    void normalizesBaseUrl() {
        assertThat(Urls.normalizeBaseUrl(" https://api.example.com/v1/?x=1#frag ")).isEqualTo("https://api.example.com/v1");
        assertThat(Urls.normalizeBaseUrl("http://localhost:8080")).isEqualTo("http://localhost:8080");
    }

    @Test
    void rejectsIncompleteBaseUrl() {
        assertThatThrownBy(() -> Urls.normalizeBaseUrl("  ")).hasMessage("baseUrl is required");
        assertThatThrownBy(() -> Urls.normalizeBaseUrl("localhost/path")).hasMessage("baseUrl must include scheme and host");
    }

    @Test
    void resolvesPathsAndSortsQuery() {
        URI uri = Urls.resolve("http://h", "catalog/list", Map.of("b", "2", "a", "x y"));

        assertThat(uri.toString()).isEqualTo("http://h/catalog/list?a=x+y&b=2");
    }
}
