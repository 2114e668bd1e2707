package io.matrixflow.sdk.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An InputStream that bounds how long each individual read may stay silent.
 *
 * <p>With a positive timeout every read is performed on a dedicated reader thread and
 * the caller waits at most the configured duration for it. There is no cumulative
 * deadline: each read starts a fresh wait, so a slow but progressing stream never times
 * out. When a read times out, {@link StreamReadTimeoutException} is thrown and no bytes
 * are delivered. The underlying read is not cancelled; it stays pending and the next
 * call to {@code read} picks up its result, so no data is lost or reordered. A blocked
 * reader thread is released by {@link #close()}, which closes the underlying stream.
 *
 * <p>The reader thread is released as soon as the end of the stream has been seen; later
 * reads keep returning {@code -1} without touching the underlying stream.
 *
 * <p>With a zero timeout all calls are delegated directly, without any thread.
 *
 * <p>Instances are meant for a single consumer. {@link #close()} may be called from any
 * thread, any number of times; only the first call has an effect.
 */
public final class TimeoutInputStream extends InputStream {
    private static final Logger logger = LoggerFactory.getLogger(TimeoutInputStream.class);

    private final InputStream in;
    private final Duration timeout;
    private final ExecutorService reader;
    private final AtomicBoolean closed = new AtomicBoolean();

    private Future<Chunk> pending;
    private boolean eof;
    private byte[] carry;
    private int carryPos;
    private int carryEnd;

    /**
     * @param in      the stream to guard
     * @param timeout idle timeout per read; {@code null}, zero or negative disables it
     */
    public TimeoutInputStream(InputStream in, Duration timeout) {
        this.in = Objects.requireNonNull(in, "in");
        this.timeout = timeout == null || timeout.isNegative() ? Duration.ZERO : timeout;
        this.reader = this.timeout.isZero() ? null : ReaderThreads.newExecutor("matrixflow-stream-reader");
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public int read() throws IOException {
        byte[] one = new byte[1];
        int n;
        do {
            n = read(one, 0, 1);
        } while (n == 0);
        return n == -1 ? -1 : (one[0] & 0xFF);
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        if (reader == null) {
            return in.read(b, off, len);
        }
        if (carryPos < carryEnd) {
            return drainCarry(b, off, len);
        }
        if (closed.get()) {
            throw new IOException("Stream closed");
        }
        if (eof) {
            return -1;
        }

        if (pending == null) {
            int size = len;
            try {
                pending = reader.submit(() -> readChunk(size));
            } catch (RejectedExecutionException e) {
                // close() won the race and shut the reader down
                throw new IOException("Stream closed", e);
            }
        }

        Chunk chunk;
        try {
            chunk = pending.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            logger.debug("No data within {}, giving up on this read", timeout);
            throw new StreamReadTimeoutException(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for stream data");
        } catch (CancellationException e) {
            pending = null;
            throw new IOException("Stream closed", e);
        } catch (ExecutionException e) {
            pending = null;
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("Stream read failed", cause);
        }
        pending = null;

        if (chunk.length() < 0) {
            eof = true;
            reader.shutdown();
            logger.debug("End of stream, reader thread released");
            return -1;
        }
        carry = chunk.bytes();
        carryPos = 0;
        carryEnd = chunk.length();
        return drainCarry(b, off, len);
    }

    private Chunk readChunk(int size) throws IOException {
        byte[] buf = new byte[size];
        int n = in.read(buf, 0, size);
        return new Chunk(buf, n);
    }

    private int drainCarry(byte[] b, int off, int len) {
        int n = Math.min(len, carryEnd - carryPos);
        System.arraycopy(carry, carryPos, b, off, n);
        carryPos += n;
        if (carryPos == carryEnd) {
            carry = null;
            carryPos = 0;
            carryEnd = 0;
        }
        return n;
    }

    @Override
    public int available() throws IOException {
        if (carryPos < carryEnd) {
            return carryEnd - carryPos;
        }
        return reader == null ? in.available() : 0;
    }

    boolean readerReleased() {
        return reader == null || reader.isShutdown();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() throws IOException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            in.close();
        } finally {
            if (reader != null) {
                reader.shutdownNow();
            }
        }
    }

    private record Chunk(byte[] bytes, int length) {}
}
