package io.matrixflow.sdk.http.spi;

import java.net.URI;

/**
 * The request never produced an HTTP response: connection refused, reset, TLS failure,
 * interruption. HTTP error statuses are not reported this way; they arrive as responses.
 */
public class HttpClientException extends Exception {
    private final HttpClientRequest.Method method;
    private final URI uri;

    public HttpClientException(HttpClientRequest request, Throwable cause) {
        this(request, "failed", cause);
    }

    protected HttpClientException(HttpClientRequest request, String what, Throwable cause) {
        super(request + " " + what + (cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage()),
                cause);
        this.method = request.method();
        this.uri = request.uri();
    }

    public HttpClientRequest.Method method() {
        return method;
    }

    public URI uri() {
        return uri;
    }
}
