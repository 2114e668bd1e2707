package io.matrixflow.sdk.http.spi;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An outgoing call to the catalog service, as handed to an {@link HttpClientAdapter}.
 *
 * <p>Header names are matched case-insensitively: setting a header that is already present
 * replaces it, keeping the casing it was first given. Iteration follows insertion order.
 */
public final class HttpClientRequest {

    /** The methods the service API uses. */
    public enum Method { GET, POST }

    static final String ACCEPT = "Accept";
    static final String CONTENT_TYPE = "Content-Type";
    static final String REQUEST_ID = "X-Request-ID";
    static final String JSON = "application/json";

    private final Method method;
    private final URI uri;
    private final Map<String, String> headers;
    private final byte[] body;
    private final Duration timeout;

    private HttpClientRequest(Builder b) {
        this.method = b.method;
        this.uri = b.uri;
        Map<String, String> copy = new LinkedHashMap<>();
        b.headers.values().forEach(h -> copy.put(h.name, h.value));
        this.headers = Collections.unmodifiableMap(copy);
        this.body = b.body;
        this.timeout = b.timeout;
    }

    public Method method() { return method; }
    public URI uri() { return uri; }
    public Map<String, String> headers() { return headers; }

    /** Request body, {@code null} when the request has none. */
    public byte[] body() { return body; }

    /** Time allowed until the response headers arrive, {@code null} for the adapter's default. */
    public Duration timeout() { return timeout; }

    public Optional<String> header(String name) {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) {
                return Optional.of(e.getValue());
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }

    public static Builder builder(Method method, URI uri) {
        return new Builder(method, uri);
    }

    public static final class Builder {
        private final Method method;
        private final URI uri;
        private final Map<String, Header> headers = new LinkedHashMap<>();
        private byte[] body;
        private Duration timeout;

        private Builder(Method method, URI uri) {
            this.method = Objects.requireNonNull(method, "method");
            this.uri = Objects.requireNonNull(uri, "uri");
        }

        /** Sets a header, replacing any value of the same name. Null names or values are skipped. */
        public Builder header(String name, String value) {
            if (name == null || name.isEmpty() || value == null) {
                return this;
            }
            Header existing = headers.get(key(name));
            headers.put(key(name), new Header(existing == null ? name : existing.name, value));
            return this;
        }

        /** Sets every entry of {@code values}, replacing existing headers. */
        public Builder headers(Map<String, String> values) {
            if (values != null) {
                values.forEach(this::header);
            }
            return this;
        }

        /** Adds entries of {@code values} whose names are not set yet. */
        public Builder headersIfAbsent(Map<String, String> values) {
            if (values != null) {
                values.forEach((name, value) -> {
                    if (name != null && !headers.containsKey(key(name))) {
                        header(name, value);
                    }
                });
            }
            return this;
        }

        /** Sets {@code X-Request-ID}; blank ids are skipped. */
        public Builder requestId(String requestId) {
            if (requestId != null && !requestId.isBlank()) {
                header(REQUEST_ID, requestId);
            }
            return this;
        }

        public Builder accept(String mediaType) {
            return header(ACCEPT, mediaType);
        }

        /** Sets a JSON body together with its content type. */
        public Builder jsonBody(byte[] json) {
            this.body = Objects.requireNonNull(json, "json");
            return header(CONTENT_TYPE, JSON);
        }

        /** Non-positive or {@code null} leaves the adapter's default in place. */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? null : timeout;
            return this;
        }

        public HttpClientRequest build() {
            return new HttpClientRequest(this);
        }

        private static String key(String name) {
            return name.toLowerCase(Locale.ROOT);
        }
    }

    private static final class Header {
        private final String name;
        private final String value;

        private Header(String name, String value) {
            this.name = name;
            this.value = value;
        }
    }
}
