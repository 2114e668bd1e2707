package io.matrixflow.sdk.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param type      {@code all} or {@code specified}
 * @param codeType  0 for company codes, 1 for business-unit codes
 * @param codeGroup code groups the analysis is restricted to
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DataScope(
        @JsonProperty("type") String type,
        @JsonProperty("code_type") Integer codeType,
        @JsonProperty("code_group") List<CodeGroup> codeGroup
) {}
