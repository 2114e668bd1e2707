package io.matrixflow.sdk.client;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record CatalogCreateRequest(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description
) {
    public CatalogCreateRequest {
        Objects.requireNonNull(name, "name");
    }
}
