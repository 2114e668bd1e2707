package io.matrixflow.sdk.client;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CatalogInfo(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description
) {}
