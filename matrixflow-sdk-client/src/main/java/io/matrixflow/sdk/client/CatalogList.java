package io.matrixflow.sdk.client;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CatalogList(@JsonProperty("list") List<CatalogSummary> list) {
    public CatalogList {
        list = list == null ? List.of() : List.copyOf(list);
    }
}
