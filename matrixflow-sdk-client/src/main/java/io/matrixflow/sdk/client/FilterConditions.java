package io.matrixflow.sdk.client;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param type {@code all} or {@code non_inter_data}
 */
public record FilterConditions(@JsonProperty("type") String type) {}
