package io.matrixflow.sdk.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Tables used for NL2SQL; {@code type} is {@code all}, {@code none} or {@code specified}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DataAskingTableConfig(
        @JsonProperty("type") String type,
        @JsonProperty("db_name") String dbName,
        @JsonProperty("table_list") List<String> tableList
) {}
