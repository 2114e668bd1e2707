package io.matrixflow.sdk.client;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CancelAnalyzeResponse(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("status") String status,
        @JsonProperty("user_id") String userId,
        @JsonProperty("user_name") String userName
) {}
