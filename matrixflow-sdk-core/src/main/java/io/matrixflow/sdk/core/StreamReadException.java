package io.matrixflow.sdk.core;

import java.io.IOException;

/**
 * Transport failure while draining an event stream. The original failure is the cause.
 */
public class StreamReadException extends IOException {

    public StreamReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
