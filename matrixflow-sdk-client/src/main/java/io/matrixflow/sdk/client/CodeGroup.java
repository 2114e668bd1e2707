package io.matrixflow.sdk.client;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CodeGroup(
        @JsonProperty("code") String code,
        @JsonProperty("name") String name,
        @JsonProperty("values") List<String> values
) {}
