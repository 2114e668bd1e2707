package io.matrixflow.sdk.core;

import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Thrown when a single read on a stream produced nothing within the configured idle timeout.
 *
 * <p>The message always carries the configured duration, e.g. {@code read timeout after 100ms}.
 */
public class StreamReadTimeoutException extends InterruptedIOException {

    private final Duration timeout;

    public StreamReadTimeoutException(Duration timeout) {
        super("read timeout after " + format(Objects.requireNonNull(timeout, "timeout")));
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }

    static String format(Duration d) {
        long millis = d.toMillis();
        if (millis > 0 && millis % 1000 == 0) {
            return (millis / 1000) + "s";
        }
        if (millis > 0) {
            return millis + "ms";
        }
        return d.toNanos() + "ns";
    }
}
