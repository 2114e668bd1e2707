package io.matrixflow.sdk.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Renames or re-describes a catalog. Members left {@code null} are not sent and keep their value.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CatalogUpdateRequest(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description
) {}
