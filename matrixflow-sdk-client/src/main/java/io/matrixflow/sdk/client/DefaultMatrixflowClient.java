package io.matrixflow.sdk.client;

import io.matrixflow.sdk.core.Protocol;
import io.matrixflow.sdk.http.spi.HttpClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

final class DefaultMatrixflowClient implements MatrixflowClient {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMatrixflowClient.class);

    private final EnvelopeTransport transport;

    DefaultMatrixflowClient(EnvelopeTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    @Override
    public HealthStatus healthCheck() throws HttpClientException {
        return transport.getPlain(Protocol.PATH_HEALTH, HealthStatus.class, CallOptions.defaults());
    }

    @Override
    public DataAnalysisStream analyzeDataStream(DataAnalysisRequest request, CallOptions options)
            throws HttpClientException {
        Objects.requireNonNull(request, "request");
        if (request.question() == null || request.question().isBlank()) {
            throw new IllegalArgumentException("question cannot be empty");
        }
        CallOptions opts = options == null ? CallOptions.defaults() : options;
        logger.debug("Starting data analysis session={}", request.sessionId());
        return transport.postEventStream(Protocol.PATH_ANALYZE, request, opts);
    }

    @Override
    public CancelAnalyzeResponse cancelAnalyze(CancelAnalyzeRequest request, CallOptions options)
            throws HttpClientException {
        String requestId = request == null || request.requestId() == null ? "" : request.requestId().trim();
        if (requestId.isEmpty()) {
            throw new IllegalArgumentException("request_id cannot be empty");
        }
        CallOptions opts = options == null ? CallOptions.defaults() : options;
        return transport.postJson(Protocol.PATH_CANCEL_ANALYZE, null, Map.of(Protocol.Q_REQUEST_ID, requestId),
                CancelAnalyzeResponse.class, opts);
    }

    @Override
    public CatalogRef createCatalog(CatalogCreateRequest request) throws HttpClientException {
        Objects.requireNonNull(request, "request");
        return post(Protocol.PATH_CATALOG_CREATE, request, CatalogRef.class);
    }

    @Override
    public CatalogRef deleteCatalog(long id) throws HttpClientException {
        return post(Protocol.PATH_CATALOG_DELETE, new CatalogRef(id), CatalogRef.class);
    }

    @Override
    public CatalogRef updateCatalog(CatalogUpdateRequest request) throws HttpClientException {
        Objects.requireNonNull(request, "request");
        return post(Protocol.PATH_CATALOG_UPDATE, request, CatalogRef.class);
    }

    @Override
    public CatalogInfo getCatalog(long id) throws HttpClientException {
        return post(Protocol.PATH_CATALOG_INFO, new CatalogRef(id), CatalogInfo.class);
    }

    @Override
    public CatalogList listCatalogs() throws HttpClientException {
        CatalogList list = post(Protocol.PATH_CATALOG_LIST, Map.of(), CatalogList.class);
        return list == null ? new CatalogList(null) : list;
    }

    private <T> T post(String path, Object body, Class<T> type) throws HttpClientException {
        return transport.postJson(path, body, null, type, CallOptions.defaults());
    }
}
