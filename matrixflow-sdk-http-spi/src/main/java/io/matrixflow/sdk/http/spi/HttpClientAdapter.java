package io.matrixflow.sdk.http.spi;

/**
 * Transport seam of the MatrixFlow client. {@link JdkHttpClientAdapter} is the default;
 * other HTTP stacks plug in by implementing these two calls.
 *
 * <p>Both calls return any status, including 4xx and 5xx; interpreting it is up to the
 * caller. Implementations must be thread-safe.
 */
public interface HttpClientAdapter {

    /**
     * Performs the request and buffers the whole response body. Used for enveloped JSON
     * calls and the health check.
     *
     * @throws HttpTimeoutException if {@link HttpClientRequest#timeout()} elapsed first
     * @throws HttpClientException if no response was received
     */
    HttpClientResponse send(HttpClientRequest request) throws HttpClientException;

    /**
     * Performs the request and returns as soon as the headers are in; the body is exposed
     * unread through {@link HttpClientResponse#bodyAsStream()} and must be closed by the
     * caller. Used for the data-analysis event stream.
     *
     * @throws HttpTimeoutException if {@link HttpClientRequest#timeout()} elapsed first
     * @throws HttpClientException if no response was received
     */
    HttpClientResponse sendStreaming(HttpClientRequest request) throws HttpClientException;
}
