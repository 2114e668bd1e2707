package io.matrixflow.sdk.http.spi;

import java.time.Duration;

/**
 * The response headers did not arrive within {@link HttpClientRequest#timeout()}.
 */
public class HttpTimeoutException extends HttpClientException {
    private final Duration timeout;

    public HttpTimeoutException(HttpClientRequest request, Throwable cause) {
        super(request, "timed out" + (request.timeout() == null ? "" : " after " + request.timeout().toMillis() + "ms"),
                cause);
        this.timeout = request.timeout();
    }

    /** The limit that was exceeded, {@code null} if the adapter's own default applied. */
    public Duration timeout() {
        return timeout;
    }
}
