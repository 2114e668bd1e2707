package io.matrixflow.sdk.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data consulted by an analysis: {@code type} is {@code all} or {@code specified}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DataSource(
        @JsonProperty("type") String type,
        @JsonProperty("tables") DataAskingTableConfig tables,
        @JsonProperty("files") FileConfig files
) {
    public static DataSource all() {
        return new DataSource("all", null, null);
    }
}
