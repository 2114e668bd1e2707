package io.matrixflow.sdk.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body of the streaming data-analysis endpoint.
 *
 * @param question    the natural-language question; must not be blank
 * @param source      optional caller tag
 * @param sessionId   optional session to continue
 * @param sessionName optional name for a new session
 * @param config      optional analysis scope
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DataAnalysisRequest(
        @JsonProperty("question") String question,
        @JsonProperty("source") String source,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("session_name") String sessionName,
        @JsonProperty("config") DataAnalysisConfig config
) {
    public static DataAnalysisRequest of(String question) {
        return new DataAnalysisRequest(question, null, null, null, null);
    }

    public DataAnalysisRequest withSession(String sessionId) {
        return new DataAnalysisRequest(question, source, sessionId, sessionName, config);
    }

    public DataAnalysisRequest withConfig(DataAnalysisConfig config) {
        return new DataAnalysisRequest(question, source, sessionId, sessionName, config);
    }
}
