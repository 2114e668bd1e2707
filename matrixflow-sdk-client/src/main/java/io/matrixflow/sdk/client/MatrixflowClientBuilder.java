package io.matrixflow.sdk.client;

import io.matrixflow.sdk.core.Protocol;
import io.matrixflow.sdk.core.Urls;
import io.matrixflow.sdk.http.spi.HttpClientAdapter;
import io.matrixflow.sdk.http.spi.JdkHttpClientAdapter;
import io.matrixflow.sdk.json.jackson.JacksonJsonCodec;
import io.matrixflow.sdk.json.spi.JsonCodec;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class MatrixflowClientBuilder {
    private String baseUrl;
    private String apiKey;
    private HttpClientAdapter httpClientAdapter;
    private JsonCodec jsonCodec;
    private String userAgent = Protocol.DEFAULT_USER_AGENT;
    private final Map<String, String> defaultHeaders = new LinkedHashMap<>();
    private Duration httpTimeout = Protocol.DEFAULT_HTTP_TIMEOUT;

    MatrixflowClientBuilder() {
    }

    /** Service root, e.g. {@code https://catalog.example.com}. Query and fragment are dropped. */
    public MatrixflowClientBuilder baseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
        return this;
    }

    public MatrixflowClientBuilder apiKey(String apiKey) {
        this.apiKey = apiKey;
        return this;
    }

    public MatrixflowClientBuilder httpClientAdapter(HttpClientAdapter adapter) {
        this.httpClientAdapter = Objects.requireNonNull(adapter, "adapter");
        return this;
    }

    public MatrixflowClientBuilder jdkHttpClient(HttpClient httpClient) {
        this.httpClientAdapter = JdkHttpClientAdapter.create(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    public MatrixflowClientBuilder jsonCodec(JsonCodec codec) {
        this.jsonCodec = Objects.requireNonNull(codec, "codec");
        return this;
    }

    /** Blank restores the default user agent. */
    public MatrixflowClientBuilder userAgent(String userAgent) {
        this.userAgent = userAgent == null || userAgent.isBlank() ? Protocol.DEFAULT_USER_AGENT : userAgent.trim();
        return this;
    }

    public MatrixflowClientBuilder defaultHeader(String name, String value) {
        if (name != null && !name.isEmpty() && value != null) {
            defaultHeaders.put(name, value);
        }
        return this;
    }

    public MatrixflowClientBuilder defaultHeaders(Map<String, String> headers) {
        if (headers != null) {
            headers.forEach(this::defaultHeader);
        }
        return this;
    }

    /**
     * Timeout of non-streaming requests; for streams it bounds the wait for response
     * headers only. {@code null}, zero or negative restores the 30 second default.
     */
    public MatrixflowClientBuilder httpTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            this.httpTimeout = Protocol.DEFAULT_HTTP_TIMEOUT;
        } else {
            this.httpTimeout = timeout;
        }
        return this;
    }

    /**
     * @throws IllegalArgumentException if the base URL or the API key is missing or invalid
     */
    public MatrixflowClient build() {
        String url = Urls.normalizeBaseUrl(baseUrl);
        String key = apiKey == null ? "" : apiKey.trim();
        if (key.isEmpty()) {
            throw new IllegalArgumentException("apiKey is required");
        }
        HttpClientAdapter adapter = httpClientAdapter;
        if (adapter == null) {
            adapter = JdkHttpClientAdapter.create();
        }
        JsonCodec codec = jsonCodec;
        if (codec == null) {
            codec = new JacksonJsonCodec();
        }
        EnvelopeTransport transport = new EnvelopeTransport(adapter, codec, url, key, userAgent, defaultHeaders, httpTimeout);
        return new DefaultMatrixflowClient(transport);
    }
}
