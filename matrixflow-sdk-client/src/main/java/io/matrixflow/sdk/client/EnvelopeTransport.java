package io.matrixflow.sdk.client;

import io.matrixflow.sdk.core.Headers;
import io.matrixflow.sdk.core.MatrixflowException;
import io.matrixflow.sdk.core.Protocol;
import io.matrixflow.sdk.core.Urls;
import io.matrixflow.sdk.http.spi.HttpClientAdapter;
import io.matrixflow.sdk.http.spi.HttpClientException;
import io.matrixflow.sdk.http.spi.HttpClientRequest;
import io.matrixflow.sdk.http.spi.HttpClientResponse;
import io.matrixflow.sdk.json.spi.JsonCodec;
import io.matrixflow.sdk.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds authenticated requests against one base URL and unwraps the service's
 * {@code {code, msg, data, request_id}} envelope.
 */
final class EnvelopeTransport {
    private static final Logger logger = LoggerFactory.getLogger(EnvelopeTransport.class);

    private final HttpClientAdapter http;
    private final JsonCodec codec;
    private final String baseUrl;
    private final String apiKey;
    private final String userAgent;
    private final Map<String, String> defaultHeaders;
    private final Duration httpTimeout;

    EnvelopeTransport(HttpClientAdapter http, JsonCodec codec, String baseUrl, String apiKey,
                      String userAgent, Map<String, String> defaultHeaders, Duration httpTimeout) {
        this.http = Objects.requireNonNull(http, "http");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.userAgent = userAgent;
        this.defaultHeaders = defaultHeaders == null ? Map.of() : Map.copyOf(defaultHeaders);
        this.httpTimeout = httpTimeout;
    }

    <T> T postJson(String path, Object body, Map<String, String> params, Class<T> type, CallOptions options)
            throws HttpClientException {
        HttpClientRequest.Builder req = request(HttpClientRequest.Method.POST, path, params, options)
                .accept(Protocol.CT_JSON);
        if (body != null) {
            req.jsonBody(encode(body));
        }
        return unwrap(http.send(req.build()), type);
    }

    /**
     * GET for endpoints that answer with a bare JSON document instead of an envelope.
     */
    <T> T getPlain(String path, Class<T> type, CallOptions options) throws HttpClientException {
        HttpClientRequest req = request(HttpClientRequest.Method.GET, path, null, options)
                .accept(Protocol.CT_JSON)
                .build();
        HttpClientResponse resp = http.send(req);
        byte[] body = resp.body() == null ? new byte[0] : resp.body();
        if (!resp.isSuccessful()) {
            throw new MatrixflowException.HttpError(resp.statusCode(), body);
        }
        return decode(body, type);
    }

    /**
     * POSTs {@code body} and opens the answer as an event stream.
     *
     * <p>A non-2xx answer or a content type other than {@code text/event-stream} or
     * {@code text/plain} is drained, closed and reported as an exception.
     */
    DataAnalysisStream postEventStream(String path, Object body, CallOptions options) throws HttpClientException {
        HttpClientRequest req = request(HttpClientRequest.Method.POST, path, null, options)
                .accept(Protocol.CT_EVENT_STREAM)
                .jsonBody(encode(body))
                .build();

        HttpClientResponse resp = http.sendStreaming(req);
        InputStream stream = resp.bodyAsStream();
        if (!resp.isSuccessful()) {
            throw new MatrixflowException.HttpError(resp.statusCode(), drain(stream));
        }
        String contentType = resp.header(Protocol.H_CONTENT_TYPE).orElse("");
        if (!Headers.isEventStream(contentType)) {
            drain(stream);
            throw new MatrixflowException.UnexpectedContentType("unexpected content type: " + contentType);
        }
        if (stream == null) {
            throw new MatrixflowException.InvalidPayload("event stream response has no body", null);
        }
        logger.debug("Opened event stream {} status={} content-type={}", path, resp.statusCode(), contentType);
        return DataAnalysisStream.open(stream, resp.headers(), resp.statusCode(), options.streamOptions(), codec);
    }

    /**
     * Starts a request carrying, in order: API key, user agent, default headers that do not
     * collide with those, request id, then the call's own headers. Callers add
     * {@code Accept} and the body afterwards, so those cannot be overridden per call.
     */
    private HttpClientRequest.Builder request(HttpClientRequest.Method method, String path,
                                              Map<String, String> params, CallOptions options) {
        Map<String, String> query = new LinkedHashMap<>(options.query());
        if (params != null) {
            query.putAll(params);
        }
        URI uri = Urls.resolve(baseUrl, path, query);
        HttpClientRequest.Builder req = HttpClientRequest.builder(method, uri)
                .header(Protocol.H_API_KEY, apiKey);
        if (userAgent != null && !userAgent.isEmpty()) {
            req.header(Protocol.H_USER_AGENT, userAgent);
        }
        return req.headersIfAbsent(defaultHeaders)
                .requestId(options.requestId())
                .headers(options.headers())
                .timeout(httpTimeout);
    }

    private byte[] encode(Object body) {
        try {
            return codec.writeBytes(body);
        } catch (JsonException e) {
            throw new MatrixflowException.InvalidPayload("failed to encode request body", e);
        }
    }

    private <T> T unwrap(HttpClientResponse resp, Class<T> type) {
        byte[] body = resp.body() == null ? new byte[0] : resp.body();
        if (!resp.isSuccessful()) {
            throw new MatrixflowException.HttpError(resp.statusCode(), body);
        }
        ApiEnvelope envelope = decode(body, ApiEnvelope.class);
        if (envelope == null) {
            throw new MatrixflowException.InvalidPayload("empty response envelope", null);
        }
        String code = envelope.code();
        if (code != null && !code.isEmpty() && !Protocol.CODE_OK.equals(code)) {
            throw new MatrixflowException.ApiError(code, envelope.msg(), envelope.requestId(), resp.statusCode());
        }
        if (envelope.data() == null || type == Void.class) {
            return null;
        }
        try {
            return codec.convertValue(envelope.data(), type);
        } catch (JsonException e) {
            throw new MatrixflowException.InvalidPayload("failed to decode response data as " + type.getSimpleName(), e);
        }
    }

    private <T> T decode(byte[] body, Class<T> type) {
        if (body.length == 0) {
            throw new MatrixflowException.InvalidPayload("empty response body", null);
        }
        try {
            return codec.readValue(body, type);
        } catch (JsonException e) {
            throw new MatrixflowException.InvalidPayload("failed to decode response body", e);
        }
    }

    private static byte[] drain(InputStream stream) {
        if (stream == null) {
            return new byte[0];
        }
        try (InputStream in = stream) {
            return in.readAllBytes();
        } catch (IOException e) {
            logger.debug("Failed to drain rejected stream response: {}", e.getMessage());
            return new byte[0];
        }
    }
}
