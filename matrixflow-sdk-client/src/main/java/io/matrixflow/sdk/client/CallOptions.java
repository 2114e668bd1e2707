package io.matrixflow.sdk.client;

import io.matrixflow.sdk.core.Protocol;
import io.matrixflow.sdk.core.StreamOptions;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call settings: request id, extra headers and query parameters, and the read-side
 * settings of streaming calls.
 *
 * <p>Headers given here override the client's default headers for this call only.
 */
public final class CallOptions {
    private static final CallOptions DEFAULTS = builder().build();

    private final String requestId;
    private final Map<String, String> headers;
    private final Map<String, String> query;
    private final int streamBufferSize;
    private final Duration streamReadTimeout;

    private CallOptions(Builder b) {
        this.requestId = b.requestId;
        this.headers = Map.copyOf(b.headers);
        this.query = Map.copyOf(b.query);
        this.streamBufferSize = b.streamBufferSize;
        this.streamReadTimeout = b.streamReadTimeout;
    }

    public static CallOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.requestId = requestId;
        b.headers.putAll(headers);
        b.query.putAll(query);
        b.streamBufferSize = streamBufferSize;
        b.streamReadTimeout = streamReadTimeout;
        return b;
    }

    /** Value of {@code X-Request-ID}, or {@code null}. */
    public String requestId() { return requestId; }
    public Map<String, String> headers() { return headers; }
    public Map<String, String> query() { return query; }

    /** Initial line-buffer size for streams; 0 selects the default. */
    public int streamBufferSize() { return streamBufferSize; }

    /** Idle timeout applied to each read of a stream. Never zero. */
    public Duration streamReadTimeout() { return streamReadTimeout; }

    public StreamOptions streamOptions() {
        return new StreamOptions(streamBufferSize, streamReadTimeout);
    }

    public static final class Builder {
        private String requestId;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final Map<String, String> query = new LinkedHashMap<>();
        private int streamBufferSize;
        private Duration streamReadTimeout = Protocol.DEFAULT_STREAM_READ_TIMEOUT;

        private Builder() {
        }

        public Builder requestId(String requestId) {
            String trimmed = requestId == null ? "" : requestId.trim();
            this.requestId = trimmed.isEmpty() ? null : trimmed;
            return this;
        }

        public Builder header(String name, String value) {
            if (name != null && !name.isEmpty() && value != null) {
                headers.put(name, value);
            }
            return this;
        }

        public Builder queryParam(String name, String value) {
            if (name != null && !name.isEmpty() && value != null) {
                query.put(name, value);
            }
            return this;
        }

        /**
         * Starting size of the stream line buffer. Lines longer than this still work, the
         * buffer grows. Non-positive values are ignored.
         */
        public Builder streamBufferSize(int bytes) {
            if (bytes > 0) {
                this.streamBufferSize = bytes;
            }
            return this;
        }

        /**
         * Idle timeout per stream read. {@code null}, zero or negative restores the
         * 60 second default.
         */
        public Builder streamReadTimeout(Duration timeout) {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                this.streamReadTimeout = Protocol.DEFAULT_STREAM_READ_TIMEOUT;
            } else {
                this.streamReadTimeout = timeout;
            }
            return this;
        }

        public CallOptions build() {
            return new CallOptions(this);
        }
    }
}
