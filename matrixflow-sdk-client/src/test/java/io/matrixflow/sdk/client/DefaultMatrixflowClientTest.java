package io.matrixflow.sdk.client;

import io.matrixflow.sdk.core.MatrixflowException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.matrixflow.sdk.http.spi.HttpTimeoutException;
import io.matrixflow.sdk.json.jackson.JacksonJsonCodec;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultMatrixflowClientTest {

    private MockWebServer server;
    private MatrixflowClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        client = MatrixflowClient.builder()
                .baseUrl(server.url("/").toString())
                .apiKey("  secret-key ")
                .defaultHeader("X-Tenant", "acme")
                .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private static MockResponse envelope(String data) {
        return new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "application/json")
                .setBody("{\"code\":\"OK\",\"msg\":\"ok\",\"data\":" + data + ",\"request_id\":\"srv-1\"}");
    }

    private static final ObjectMapper MAPPER = JacksonJsonCodec.defaultMapper();

    private static void assertJsonBody(RecordedRequest recorded, String expected) throws Exception {
        assertThat(MAPPER.readTree(recorded.getBody().readUtf8())).isEqualTo(MAPPER.readTree(expected));
    }

    private RecordedRequest take() throws InterruptedException {
        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded).isNotNull();
        return recorded;
    }

    @Test
    void streamsAnalysisEvents() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "text/event-stream; charset=utf-8")
                .setBody("data: {\"step_type\":\"init\",\"data\":{\"request_id\":\"req-9\"}}\n\n"
                        + "event: decomposition\n"
                        + "data: {\"type\":\"decomposition\",\"source\":\"rag\"}\n\n"
                        + "data: {\"type\":\"complete\"}\n\n"));

        List<DataAnalysisStreamEvent> events = new ArrayList<>();
        try (DataAnalysisStream stream = client.analyzeDataStream(
                DataAnalysisRequest.of("How many orders last week?").withSession("s-1"))) {
            assertThat(stream.statusCode()).isEqualTo(200);
            DataAnalysisStreamEvent ev;
            while ((ev = stream.readEvent()) != null) {
                events.add(ev);
            }
        }

        assertThat(events).hasSize(3);
        assertThat(events.get(0).initRequestId()).contains("req-9");
        assertThat(events.get(1).type()).isEqualTo("decomposition");
        assertThat(events.get(1).source()).isEqualTo("rag");
        assertThat(events.get(2).type()).isEqualTo("complete");

        RecordedRequest recorded = take();
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getPath()).isEqualTo("/byoa/api/v1/data_asking/analyze");
        assertThat(recorded.getHeader("Accept")).isEqualTo("text/event-stream");
        assertThat(recorded.getHeader("Content-Type")).isEqualTo("application/json");
        assertJsonBody(recorded, "{\"question\":\"How many orders last week?\",\"session_id\":\"s-1\"}");
    }

    @Test
    void acceptsTextPlainStreams() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "text/plain")
                .setBody("data: hello\n\n"));

        try (DataAnalysisStream stream = client.analyzeDataStream(DataAnalysisRequest.of("q"))) {
            DataAnalysisStreamEvent ev = stream.readEvent();
            assertThat(ev.rawData()).isEqualTo("hello");
            assertThat(ev.payload()).isEmpty();
        }
    }

    @Test
    void rejectsNonSuccessStreamResponse() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        assertThatThrownBy(() -> client.analyzeDataStream(DataAnalysisRequest.of("q")))
                .isInstanceOfSatisfying(MatrixflowException.HttpError.class, e -> {
                    assertThat(e.statusCode()).isEqualTo(500);
                    assertThat(new String(e.body(), StandardCharsets.UTF_8)).isEqualTo("boom");
                });
    }

    @Test
    void rejectsUnexpectedStreamContentType() {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "application/json")
                .setBody("{\"code\":\"OK\"}"));

        assertThatThrownBy(() -> client.analyzeDataStream(DataAnalysisRequest.of("q")))
                .isInstanceOf(MatrixflowException.UnexpectedContentType.class)
                .hasMessageContaining("application/json");
    }

    @Test
    void validatesAnalysisRequestBeforeSending() {
        assertThatThrownBy(() -> client.analyzeDataStream(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("request");
        assertThatThrownBy(() -> client.analyzeDataStream(DataAnalysisRequest.of("   ")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("question cannot be empty");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void streamOptionsApplyPerCall() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "text/event-stream")
                .setBody("data: {\"type\":\"complete\"}\n\n"));

        CallOptions options = CallOptions.builder()
                .requestId("trace-1")
                .header("X-Tenant", "other")
                .streamBufferSize(8)
                .streamReadTimeout(Duration.ofSeconds(5))
                .build();
        try (DataAnalysisStream stream = client.analyzeDataStream(DataAnalysisRequest.of("q"), options)) {
            assertThat(stream.readEvent().type()).isEqualTo("complete");
            assertThat(stream.readEvent()).isNull();
        }

        RecordedRequest recorded = take();
        assertThat(recorded.getHeader("X-Request-ID")).isEqualTo("trace-1");
        assertThat(recorded.getHeader("X-Tenant")).isEqualTo("other");
    }

    @Test
    void callHeadersCannotOverrideStreamNegotiation() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "text/event-stream")
                .setBody(""));

        CallOptions options = CallOptions.builder()
                .header("accept", "application/json")
                .header("Content-Type", "text/plain")
                .build();
        try (DataAnalysisStream stream = client.analyzeDataStream(DataAnalysisRequest.of("q"), options)) {
            assertThat(stream.readEvent()).isNull();
        }

        RecordedRequest recorded = take();
        assertThat(recorded.getHeaders().values("Accept")).containsExactly("text/event-stream");
        assertThat(recorded.getHeaders().values("Content-Type")).containsExactly("application/json");
    }

    @Test
    void defaultHeadersCannotReplaceTheApiKey() throws Exception {
        MatrixflowClient overridden = MatrixflowClient.builder()
                .baseUrl(server.url("/").toString())
                .apiKey("real-key")
                .defaultHeader("MOI-KEY", "other-key")
                .build();
        server.enqueue(envelope("{\"list\":[]}"));

        overridden.listCatalogs();

        assertThat(take().getHeaders().values("moi-key")).containsExactly("real-key");
    }

    @Test
    void cancelsByRequestId() throws Exception {
        server.enqueue(envelope("{\"request_id\":\"req-9\",\"status\":\"cancelled\",\"user_id\":\"u1\",\"user_name\":\"ann\"}"));

        CancelAnalyzeResponse resp = client.cancelAnalyze(new CancelAnalyzeRequest(" req-9 "));

        assertThat(resp).isEqualTo(new CancelAnalyzeResponse("req-9", "cancelled", "u1", "ann"));
        RecordedRequest recorded = take();
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getPath()).isEqualTo("/byoa/api/v1/data_asking/cancel?request_id=req-9");
        assertThat(recorded.getBodySize()).isZero();
    }

    @Test
    void cancelRequiresRequestId() {
        assertThatThrownBy(() -> client.cancelAnalyze(new CancelAnalyzeRequest(" ")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("request_id cannot be empty");
        assertThatThrownBy(() -> client.cancelAnalyze(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sendsAuthenticationAndDefaultHeaders() throws Exception {
        server.enqueue(envelope("{\"list\":[]}"));

        client.listCatalogs();

        RecordedRequest recorded = take();
        assertThat(recorded.getHeader("moi-key")).isEqualTo("secret-key");
        assertThat(recorded.getHeader("User-Agent")).isEqualTo("matrixflow-sdk-java/0.1.0");
        assertThat(recorded.getHeader("X-Tenant")).isEqualTo("acme");
        assertThat(recorded.getHeader("Accept")).isEqualTo("application/json");
        assertThat(recorded.getHeader("X-Request-ID")).isNull();
    }

    @Test
    void listsCatalogs() throws Exception {
        server.enqueue(envelope("{\"list\":[{\"id\":1,\"name\":\"sales\",\"database_count\":2,\"unknown\":\"x\"}]}"));

        CatalogList list = client.listCatalogs();

        assertThat(list.list()).hasSize(1);
        assertThat(list.list().get(0).id()).isEqualTo(1L);
        assertThat(list.list().get(0).name()).isEqualTo("sales");
        RecordedRequest recorded = take();
        assertThat(recorded.getPath()).isEqualTo("/catalog/list");
        assertJsonBody(recorded, "{}");
    }

    @Test
    void missingDataYieldsEmptyList() throws Exception {
        server.enqueue(envelope("null"));

        assertThat(client.listCatalogs().list()).isEmpty();
    }

    @Test
    void createsUpdatesAndDeletesCatalogs() throws Exception {
        server.enqueue(envelope("{\"id\":7}"));
        server.enqueue(envelope("{\"id\":7}"));
        server.enqueue(envelope("{\"id\":7,\"name\":\"renamed\",\"description\":\"d\"}"));
        server.enqueue(envelope("{\"id\":7}"));

        assertThat(client.createCatalog(new CatalogCreateRequest("sales", null)).id()).isEqualTo(7L);
        assertThat(client.updateCatalog(new CatalogUpdateRequest(7, "renamed", null)).id()).isEqualTo(7L);
        assertThat(client.getCatalog(7)).isEqualTo(new CatalogInfo(7, "renamed", "d"));
        assertThat(client.deleteCatalog(7).id()).isEqualTo(7L);

        RecordedRequest create = take();
        assertThat(create.getPath()).isEqualTo("/catalog/create");
        assertJsonBody(create, "{\"name\":\"sales\"}");
        RecordedRequest update = take();
        assertThat(update.getPath()).isEqualTo("/catalog/update");
        assertJsonBody(update, "{\"id\":7,\"name\":\"renamed\"}");
        RecordedRequest info = take();
        assertThat(info.getPath()).isEqualTo("/catalog/info");
        assertJsonBody(info, "{\"id\":7}");
        assertThat(take().getPath()).isEqualTo("/catalog/delete");
    }

    @Test
    void envelopeErrorBecomesApiError() {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("{\"code\":\"ErrNotFound\",\"msg\":\"catalog not found\",\"request_id\":\"srv-2\"}"));

        assertThatThrownBy(() -> client.getCatalog(99))
                .isInstanceOfSatisfying(MatrixflowException.ApiError.class, e -> {
                    assertThat(e.code()).isEqualTo("ErrNotFound");
                    assertThat(e.serviceMessage()).isEqualTo("catalog not found");
                    assertThat(e.requestId()).isEqualTo("srv-2");
                    assertThat(e.httpStatus()).isEqualTo(200);
                })
                .hasMessageContaining("code=ErrNotFound");
    }

    @Test
    void httpErrorKeepsBody() {
        server.enqueue(new MockResponse().setResponseCode(403).setBody("forbidden"));

        assertThatThrownBy(() -> client.listCatalogs())
                .isInstanceOfSatisfying(MatrixflowException.HttpError.class,
                        e -> assertThat(e.statusCode()).isEqualTo(403))
                .hasMessage("http error: status=403 body=forbidden");
    }

    @Test
    void undecodableEnvelopeIsInvalidPayload() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>"));

        assertThatThrownBy(() -> client.listCatalogs())
                .isInstanceOf(MatrixflowException.InvalidPayload.class);
    }

    @Test
    void healthCheckReadsBareJson() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "application/json")
                .setBody("{\"status\":\"ok\"}"));

        assertThat(client.healthCheck()).isEqualTo(new HealthStatus("ok"));
        RecordedRequest recorded = take();
        assertThat(recorded.getMethod()).isEqualTo("GET");
        assertThat(recorded.getPath()).isEqualTo("/healthz");
    }

    @Test
    void slowHeadersHitTheHttpTimeout() throws Exception {
        MatrixflowClient impatient = MatrixflowClient.builder()
                .baseUrl(server.url("/").toString())
                .apiKey("k")
                .httpTimeout(Duration.ofMillis(200))
                .build();
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeadersDelay(2, TimeUnit.SECONDS)
                .setBody("{\"status\":\"ok\"}"));

        assertThatThrownBy(impatient::healthCheck)
                .isInstanceOf(HttpTimeoutException.class);
    }
}
