package io.matrixflow.sdk.client;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON wrapper of every non-streaming answer: {@code {code, msg, data, request_id}}.
 * {@code data} stays untyped until the caller binds it.
 */
public record ApiEnvelope(
        @JsonProperty("code") String code,
        @JsonProperty("msg") String msg,
        @JsonProperty("data") Object data,
        @JsonProperty("request_id") String requestId
) {}
