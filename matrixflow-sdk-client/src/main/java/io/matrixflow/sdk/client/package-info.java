/**
 * MatrixFlow catalog service client.
 *
 * <p>Entry point is {@link io.matrixflow.sdk.client.MatrixflowClient#builder()}. Streaming
 * analyses are read through {@link io.matrixflow.sdk.client.DataAnalysisStream}; all other
 * calls return the decoded {@code data} of the service envelope.
 */
package io.matrixflow.sdk.client;
