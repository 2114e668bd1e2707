package io.matrixflow.sdk.client;

/**
 * Cancels a running analysis. The request id is the one announced by the stream's
 * {@code init} event, see {@link DataAnalysisStreamEvent#initRequestId()}.
 */
public record CancelAnalyzeRequest(String requestId) {}
