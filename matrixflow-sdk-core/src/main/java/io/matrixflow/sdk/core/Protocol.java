package io.matrixflow.sdk.core;

import java.time.Duration;

/**
 * Catalog service protocol constants (paths, header names, and well-known values).
 *
 * <p>This class contains no HTTP client bindings. It only models protocol-level concerns
 * shared by the client modules.
 */
public final class Protocol {
    private Protocol() {}

    // Endpoint paths
    public static final String PATH_HEALTH = "/healthz";
    public static final String PATH_ANALYZE = "/byoa/api/v1/data_asking/analyze";
    public static final String PATH_CANCEL_ANALYZE = "/byoa/api/v1/data_asking/cancel";
    public static final String PATH_CATALOG_CREATE = "/catalog/create";
    public static final String PATH_CATALOG_DELETE = "/catalog/delete";
    public static final String PATH_CATALOG_UPDATE = "/catalog/update";
    public static final String PATH_CATALOG_INFO = "/catalog/info";
    public static final String PATH_CATALOG_LIST = "/catalog/list";

    // Query parameter keys
    public static final String Q_REQUEST_ID = "request_id";

    // Request headers
    public static final String H_API_KEY = "moi-key";
    public static final String H_USER_AGENT = "User-Agent";
    public static final String H_CONTENT_TYPE = "Content-Type";

    // Content types
    public static final String CT_JSON = "application/json";
    public static final String CT_EVENT_STREAM = "text/event-stream";
    /** Accepted as a stream content type because some proxies re-tag event streams. */
    public static final String CT_TEXT_PLAIN = "text/plain";

    /** Envelope code reported by successful calls. */
    public static final String CODE_OK = "OK";

    public static final String DEFAULT_USER_AGENT = "matrixflow-sdk-java/0.1.0";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_STREAM_READ_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_STREAM_BUFFER_SIZE = 4096;
}
