package io.matrixflow.sdk.http.spi;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link HttpClientAdapter} implementation using the JDK 11+ HttpClient.
 * This is the default implementation used by the MatrixFlow client.
 */
public final class JdkHttpClientAdapter implements HttpClientAdapter {

    private final HttpClient httpClient;

    public JdkHttpClientAdapter(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * Creates a new adapter with a default HttpClient.
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create() {
        return new JdkHttpClientAdapter(HttpClient.newHttpClient());
    }

    /**
     * Creates a new adapter with the specified HttpClient.
     * @param httpClient the HttpClient to use
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create(HttpClient httpClient) {
        return new JdkHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        HttpResponse<byte[]> response = exchange(request, HttpResponse.BodyHandlers.ofByteArray());
        return new JdkResponse(response, response.body(), null);
    }

    @Override
    public HttpClientResponse sendStreaming(HttpClientRequest request) throws HttpClientException {
        HttpResponse<InputStream> response = exchange(request, HttpResponse.BodyHandlers.ofInputStream());
        return new JdkResponse(response, null, response.body());
    }

    private <T> HttpResponse<T> exchange(HttpClientRequest request, HttpResponse.BodyHandler<T> handler)
            throws HttpClientException {
        try {
            return httpClient.send(toJdkRequest(request), handler);
        } catch (java.net.http.HttpTimeoutException e) {
            throw new HttpTimeoutException(request, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpClientException(request, "interrupted", e);
        } catch (IOException | IllegalArgumentException e) {
            throw new HttpClientException(request, e);
        }
    }

    private static HttpRequest toJdkRequest(HttpClientRequest request) {
        HttpRequest.BodyPublisher publisher = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());

        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
                .method(request.method().name(), publisher);
        request.headers().forEach(builder::header);
        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }
        return builder.build();
    }

    private static final class JdkResponse implements HttpClientResponse {
        private final HttpResponse<?> response;
        private final byte[] body;
        private final InputStream stream;

        JdkResponse(HttpResponse<?> response, byte[] body, InputStream stream) {
            this.response = response;
            this.body = body;
            this.stream = stream;
        }

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public Optional<String> header(String name) {
            return response.headers().firstValue(name);
        }

        @Override
        public Map<String, List<String>> headers() {
            return response.headers().map();
        }

        @Override
        public byte[] body() {
            return body;
        }

        @Override
        public InputStream bodyAsStream() {
            return stream;
        }
    }
}
