package io.matrixflow.sdk.client;

import io.matrixflow.sdk.core.Headers;
import io.matrixflow.sdk.core.SseParser;
import io.matrixflow.sdk.core.StreamOptions;
import io.matrixflow.sdk.core.StreamReadException;
import io.matrixflow.sdk.core.StreamReadTimeoutException;
import io.matrixflow.sdk.core.TimeoutInputStream;
import io.matrixflow.sdk.json.spi.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A Server-Sent Events response of the data-analysis endpoint.
 *
 * <p>Typical use:
 * <pre>{@code
 * try (DataAnalysisStream stream = client.analyzeDataStream(DataAnalysisRequest.of("Why did revenue drop?"))) {
 *     DataAnalysisStreamEvent event;
 *     while ((event = stream.readEvent()) != null) {
 *         System.out.println(event.type() + " " + event.rawData());
 *     }
 * }
 * }</pre>
 *
 * <p>Events are returned in stream order. A stream has a single reader; {@link #close()}
 * may be called from any thread (e.g. to cancel) and only the first call has an effect.
 */
public final class DataAnalysisStream implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(DataAnalysisStream.class);

    private final InputStream body;
    private final SseParser parser;
    private final Map<String, List<String>> headers;
    private final int statusCode;
    private final JsonCodec codec;
    private final AtomicBoolean closed = new AtomicBoolean();

    private DataAnalysisStream(InputStream body, Map<String, List<String>> headers, int statusCode,
                               int initialBufferSize, JsonCodec codec) {
        this.body = body;
        this.parser = new SseParser(body, initialBufferSize);
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.statusCode = statusCode;
        this.codec = codec;
    }

    /**
     * Wraps an already validated event-stream response body.
     *
     * @param body       the response body; owned by the returned stream from now on
     * @param headers    response headers
     * @param statusCode response status
     * @param options    buffer and idle-timeout settings; {@code null} for defaults without timeout
     * @param codec      codec used to decode event payloads
     */
    public static DataAnalysisStream open(InputStream body, Map<String, List<String>> headers, int statusCode,
                                          StreamOptions options, JsonCodec codec) {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(codec, "codec");
        StreamOptions opts = options == null ? StreamOptions.defaults() : options;
        InputStream source = opts.hasReadTimeout() ? new TimeoutInputStream(body, opts.readTimeout()) : body;
        return new DataAnalysisStream(source, headers, statusCode, opts.initialBufferSize(), codec);
    }

    /**
     * Reads the next event, blocking until a frame is complete.
     *
     * @return the next event, or {@code null} at the end of the stream
     * @throws StreamReadTimeoutException if the server stayed silent longer than the idle timeout
     * @throws StreamReadException if the connection failed
     */
    public DataAnalysisStreamEvent readEvent() throws IOException {
        SseParser.Event frame = parser.next();
        if (frame == null) {
            return null;
        }
        return DataAnalysisStreamEvent.decode(frame.eventType(), frame.data(), codec);
    }

    public int statusCode() {
        return statusCode;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        return Headers.firstValue(headers, name);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() throws IOException {
        if (closed.compareAndSet(false, true)) {
            logger.debug("Closing analysis stream");
            body.close();
        }
    }
}
