package io.matrixflow.sdk.client;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code /healthz}, which is not wrapped in an envelope.
 */
public record HealthStatus(@JsonProperty("status") String status) {}
