package io.matrixflow.sdk.core;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Server-Sent Events frame reader for the data-analysis stream.
 *
 * <p>Only the {@code event: } and {@code data: } fields are interpreted (exact, case-sensitive
 * prefixes with one space). Multiple data lines are joined with {@code \n}, the last event
 * line wins, and every other line ({@code id:}, {@code retry:}, comments, unknown fields) is
 * skipped. A blank line closes a frame only when data is pending; a frame still open at end
 * of stream is returned as if it had been terminated.
 *
 * <p>Not thread-safe: one consumer per stream.
 */
public final class SseParser implements AutoCloseable {

    /**
     * One reassembled frame.
     *
     * @param eventType value of the {@code event:} field, empty if the frame had none
     * @param data      data lines joined with {@code \n}
     */
    public record Event(String eventType, String data) {}

    private static final String DATA_PREFIX = "data: ";
    private static final String EVENT_PREFIX = "event: ";

    private final InputStream in;
    private final LineReader lines;

    /**
     * Creates a new SSE parser reading from the given input stream.
     *
     * @param is the input stream to read from
     */
    public SseParser(InputStream is) {
        this(is, Protocol.DEFAULT_STREAM_BUFFER_SIZE);
    }

    /**
     * @param is                the input stream to read from
     * @param initialBufferSize starting size of the line buffer, {@code <= 0} for the default
     */
    public SseParser(InputStream is, int initialBufferSize) {
        this.in = Objects.requireNonNull(is, "is");
        this.lines = new LineReader(is, initialBufferSize);
    }

    /**
     * Reads the next SSE event from the stream.
     *
     * @return the next event, or {@code null} once the stream is exhausted
     * @throws StreamReadTimeoutException if an underlying read exceeded its idle timeout
     * @throws StreamReadException if the underlying stream failed
     */
    public Event next() throws IOException {
        List<String> data = new ArrayList<>();
        String eventType = "";

        while (true) {
            String line;
            try {
                line = lines.readLine();
            } catch (StreamReadTimeoutException e) {
                throw e;
            } catch (IOException e) {
                throw new StreamReadException("failed reading stream", e);
            }

            if (line == null) {
                return data.isEmpty() ? null : new Event(eventType, String.join("\n", data));
            }
            if (line.isEmpty()) {
                if (!data.isEmpty()) {
                    return new Event(eventType, String.join("\n", data));
                }
                continue;
            }
            if (line.startsWith(DATA_PREFIX)) {
                data.add(line.substring(DATA_PREFIX.length()));
            } else if (line.startsWith(EVENT_PREFIX)) {
                eventType = line.substring(EVENT_PREFIX.length());
            }
        }
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
