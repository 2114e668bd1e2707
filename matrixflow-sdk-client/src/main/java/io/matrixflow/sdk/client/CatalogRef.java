package io.matrixflow.sdk.client;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A catalog id, used both as the body of id-only requests and as the answer of
 * create, update and delete.
 */
public record CatalogRef(@JsonProperty("id") long id) {}
