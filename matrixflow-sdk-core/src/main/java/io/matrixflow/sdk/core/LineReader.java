package io.matrixflow.sdk.core;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Reads {@code \n}-terminated UTF-8 lines from a byte stream, with no limit on line length.
 *
 * <p>The internal buffer starts at the requested size and doubles whenever a line does not
 * fit. A trailing {@code \r} is stripped from each line. Unterminated data at the end of
 * the stream is returned as a final line.
 */
public final class LineReader {
    private static final int MAX_BUFFER_SIZE = Integer.MAX_VALUE - 8;

    private final InputStream in;
    private byte[] buf;
    private int start;
    private int end;
    private boolean eof;

    public LineReader(InputStream in) {
        this(in, Protocol.DEFAULT_STREAM_BUFFER_SIZE);
    }

    /**
     * @param in                the stream to read from
     * @param initialBufferSize starting buffer size; {@code <= 0} selects the default
     */
    public LineReader(InputStream in, int initialBufferSize) {
        this.in = Objects.requireNonNull(in, "in");
        this.buf = new byte[initialBufferSize > 0 ? initialBufferSize : Protocol.DEFAULT_STREAM_BUFFER_SIZE];
    }

    /**
     * Reads the next line.
     *
     * @return the line without its terminator, or {@code null} at end of stream
     * @throws IOException if the underlying stream fails
     */
    public String readLine() throws IOException {
        int scanned = 0;
        while (true) {
            for (int i = start + scanned; i < end; i++) {
                if (buf[i] == '\n') {
                    String line = decode(start, i);
                    start = i + 1;
                    return line;
                }
            }
            scanned = end - start;

            if (eof) {
                if (end > start) {
                    String line = decode(start, end);
                    start = end;
                    return line;
                }
                return null;
            }

            makeRoom();
            int n = in.read(buf, end, buf.length - end);
            if (n < 0) {
                eof = true;
            } else {
                end += n;
            }
        }
    }

    /** Current capacity of the internal buffer. */
    int bufferSize() {
        return buf.length;
    }

    private void makeRoom() {
        if (end < buf.length) {
            return;
        }
        if (start > 0) {
            System.arraycopy(buf, start, buf, 0, end - start);
            end -= start;
            start = 0;
            return;
        }
        if (buf.length >= MAX_BUFFER_SIZE) {
            throw new OutOfMemoryError("line exceeds maximum buffer size");
        }
        int grown = (int) Math.min((long) buf.length * 2, MAX_BUFFER_SIZE);
        buf = Arrays.copyOf(buf, grown);
    }

    private String decode(int from, int to) {
        if (to > from && buf[to - 1] == '\r') {
            to--;
        }
        return new String(buf, from, to - from, StandardCharsets.UTF_8);
    }
}
