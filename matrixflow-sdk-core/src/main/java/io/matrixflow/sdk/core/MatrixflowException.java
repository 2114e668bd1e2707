package io.matrixflow.sdk.core;

/**
 * Base class for MatrixFlow SDK exceptions raised by request/response calls.
 *
 * <p>Provides a common hierarchy for service-level and protocol errors. Stream read
 * failures are reported as {@link java.io.IOException}s instead, see
 * {@link StreamReadException} and {@link StreamReadTimeoutException}.
 */
public abstract class MatrixflowException extends RuntimeException {

    protected MatrixflowException(String message) {
        super(message);
    }

    protected MatrixflowException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when the service answers with an envelope whose code is not {@code OK}.
     */
    public static class ApiError extends MatrixflowException {
        private final String code;
        private final String serviceMessage;
        private final String requestId;
        private final int httpStatus;

        public ApiError(String code, String serviceMessage, String requestId, int httpStatus) {
            super("catalog service error: code=" + code + " msg=" + serviceMessage
                    + " request_id=" + requestId + " status=" + httpStatus);
            this.code = code;
            this.serviceMessage = serviceMessage;
            this.requestId = requestId;
            this.httpStatus = httpStatus;
        }

        public String code() {
            return code;
        }

        public String serviceMessage() {
            return serviceMessage;
        }

        public String requestId() {
            return requestId;
        }

        public int httpStatus() {
            return httpStatus;
        }
    }

    /**
     * Raised for a non-2xx HTTP response, before any envelope could be parsed.
     */
    public static class HttpError extends MatrixflowException {
        private final int statusCode;
        private final byte[] body;

        public HttpError(int statusCode, byte[] body) {
            super(body == null || body.length == 0
                    ? "http error: status=" + statusCode
                    : "http error: status=" + statusCode + " body=" + new String(body, java.nio.charset.StandardCharsets.UTF_8));
            this.statusCode = statusCode;
            this.body = body == null ? new byte[0] : body;
        }

        public int statusCode() {
            return statusCode;
        }

        public byte[] body() {
            return body.clone();
        }
    }

    /**
     * Raised when a streaming endpoint answers with something other than an event stream.
     */
    public static class UnexpectedContentType extends MatrixflowException {
        public UnexpectedContentType(String message) {
            super(message);
        }
    }

    /**
     * Raised when a request cannot be serialized or a response cannot be decoded.
     */
    public static class InvalidPayload extends MatrixflowException {
        public InvalidPayload(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
