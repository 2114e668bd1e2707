package io.matrixflow.sdk.client;

import io.matrixflow.sdk.http.spi.HttpClientException;

/**
 * Client of the MatrixFlow catalog service.
 *
 * <p>Non-streaming calls return the decoded {@code data} member of the service envelope and
 * raise {@link io.matrixflow.sdk.core.MatrixflowException} subclasses for HTTP and service
 * errors. Instances are thread-safe.
 */
public interface MatrixflowClient {

    HealthStatus healthCheck() throws HttpClientException;

    /**
     * Starts a data analysis and returns its event stream. The caller must close the stream.
     *
     * @throws NullPointerException if {@code request} is null
     * @throws IllegalArgumentException if the question is blank
     */
    DataAnalysisStream analyzeDataStream(DataAnalysisRequest request, CallOptions options) throws HttpClientException;

    default DataAnalysisStream analyzeDataStream(DataAnalysisRequest request) throws HttpClientException {
        return analyzeDataStream(request, CallOptions.defaults());
    }

    /**
     * Cancels a running analysis.
     *
     * @throws IllegalArgumentException if the request id is blank
     */
    CancelAnalyzeResponse cancelAnalyze(CancelAnalyzeRequest request, CallOptions options) throws HttpClientException;

    default CancelAnalyzeResponse cancelAnalyze(CancelAnalyzeRequest request) throws HttpClientException {
        return cancelAnalyze(request, CallOptions.defaults());
    }

    CatalogRef createCatalog(CatalogCreateRequest request) throws HttpClientException;

    CatalogRef deleteCatalog(long id) throws HttpClientException;

    CatalogRef updateCatalog(CatalogUpdateRequest request) throws HttpClientException;

    CatalogInfo getCatalog(long id) throws HttpClientException;

    CatalogList listCatalogs() throws HttpClientException;

    static MatrixflowClientBuilder builder() {
        return new MatrixflowClientBuilder();
    }
}
