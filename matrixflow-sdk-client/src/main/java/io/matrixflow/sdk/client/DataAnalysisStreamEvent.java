package io.matrixflow.sdk.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.matrixflow.sdk.json.spi.JsonCodec;
import io.matrixflow.sdk.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One event of the data-analysis stream.
 *
 * <p>{@code rawData} is the exact content of the frame's data lines and is always set.
 * {@code payload} is present only when that content decodes as a JSON object; the
 * server's event shapes vary (classification, decomposition, step markers, answer chunks,
 * completion, errors), so a missing payload is normal and callers can fall back to
 * {@code rawData}.
 *
 * @param eventName value of the SSE {@code event:} field, empty if the frame had none
 * @param rawData   the frame's data lines joined with {@code \n}
 * @param payload   the decoded common fields, if the data is a JSON object
 */
public record DataAnalysisStreamEvent(String eventName, String rawData, Optional<Payload> payload) {
    private static final Logger logger = LoggerFactory.getLogger(DataAnalysisStreamEvent.class);

    public DataAnalysisStreamEvent {
        eventName = eventName == null ? "" : eventName;
        Objects.requireNonNull(rawData, "rawData");
        payload = payload == null ? Optional.empty() : payload;
    }

    /**
     * Fields shared by the server's JSON event shapes. Events from the NL2SQL path carry
     * {@code step_type}/{@code step_name} instead of {@code type}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Payload(
            @JsonProperty("type") String type,
            @JsonProperty("source") String source,
            @JsonProperty("step_type") String stepType,
            @JsonProperty("step_name") String stepName,
            @JsonProperty("data") Map<String, Object> data
    ) {}

    static DataAnalysisStreamEvent decode(String eventName, String rawData, JsonCodec codec) {
        Optional<Payload> payload = Optional.empty();
        if (!rawData.isEmpty()) {
            try {
                payload = Optional.ofNullable(codec.readValue(rawData, Payload.class));
            } catch (JsonException e) {
                logger.debug("Keeping raw data only for event '{}': {}", eventName, e.getMessage());
            }
        }
        return new DataAnalysisStreamEvent(eventName, rawData, payload);
    }

    /**
     * The event type: the SSE event name when the frame had one, otherwise the payload's
     * {@code type}, otherwise empty.
     */
    public String type() {
        if (!eventName.isEmpty()) {
            return eventName;
        }
        return payload.map(Payload::type).orElse("");
    }

    public String source() {
        return payload.map(Payload::source).orElse("");
    }

    public String stepType() {
        return payload.map(Payload::stepType).orElse("");
    }

    public String stepName() {
        return payload.map(Payload::stepName).orElse("");
    }

    /** The payload's nested {@code data} object, empty if absent. */
    public Map<String, Object> data() {
        return payload.map(Payload::data).orElse(Map.of());
    }

    /**
     * The request id announced by the stream's first ({@code step_type=init}) event. It is
     * the key for {@link MatrixflowClient#cancelAnalyze(CancelAnalyzeRequest)}.
     */
    public Optional<String> initRequestId() {
        if (!"init".equals(stepType())) {
            return Optional.empty();
        }
        Object id = data().get("request_id");
        return id instanceof String ? Optional.of((String) id) : Optional.empty();
    }
}
