package io.matrixflow.sdk.core;

import java.time.Duration;

/**
 * Read-side settings for an event stream.
 *
 * @param initialBufferSize starting size of the line buffer in bytes; values {@code <= 0}
 *                          select {@link Protocol#DEFAULT_STREAM_BUFFER_SIZE}. The buffer grows as needed.
 * @param readTimeout idle timeout applied to each underlying read; {@code null} or a
 *                    non-positive duration disables it
 */
public record StreamOptions(int initialBufferSize, Duration readTimeout) {

    public StreamOptions {
        if (initialBufferSize <= 0) {
            initialBufferSize = Protocol.DEFAULT_STREAM_BUFFER_SIZE;
        }
        if (readTimeout == null || readTimeout.isNegative()) {
            readTimeout = Duration.ZERO;
        }
    }

    /** Default buffer size and no idle timeout. */
    public static StreamOptions defaults() {
        return new StreamOptions(0, Duration.ZERO);
    }

    public boolean hasReadTimeout() {
        return !readTimeout.isZero();
    }
}
