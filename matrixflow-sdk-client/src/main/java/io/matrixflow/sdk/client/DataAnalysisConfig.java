package io.matrixflow.sdk.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Scope of a data-analysis request.
 *
 * @param dataCategory     {@code admin} or {@code common}
 * @param filterConditions optional filter
 * @param dataSource       optional table/file selection
 * @param dataScope        optional code-group restriction
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DataAnalysisConfig(
        @JsonProperty("data_category") String dataCategory,
        @JsonProperty("filter_conditions") FilterConditions filterConditions,
        @JsonProperty("data_source") DataSource dataSource,
        @JsonProperty("data_scope") DataScope dataScope
) {
    public static DataAnalysisConfig of(String dataCategory, DataSource dataSource) {
        return new DataAnalysisConfig(dataCategory, null, dataSource, null);
    }
}
