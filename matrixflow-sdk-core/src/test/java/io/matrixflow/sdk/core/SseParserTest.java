package io.matrixflow.sdk.core;

import io.matrixflow.sdk.core.test.BlockingInputStream;
import io.matrixflow.sdk.core.test.FailingInputStream;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SseParserTest {

    private static SseParser parser(String body) {
        return new SseParser(new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
    }

    private static List<SseParser.Event> readAll(SseParser parser) throws IOException {
        List<SseParser.Event> events = new ArrayList<>();
        SseParser.Event ev;
        while ((ev = parser.next()) != null) {
            events.add(ev);
        }
        return events;
    }

    @Test
    void readsFramesInOrder() throws IOException {
        String body = "event: classification\n"
                + "data: {\"type\":\"classification\"}\n\n"
                + "event: step_start\n"
                + "data: {\"step_name\":\"plan\"}\n\n"
                + "data: {\"type\":\"complete\"}\n\n";

        List<SseParser.Event> events = readAll(parser(body));

        assertThat(events).containsExactly(
                new SseParser.Event("classification", "{\"type\":\"classification\"}"),
                new SseParser.Event("step_start", "{\"step_name\":\"plan\"}"),
                new SseParser.Event("", "{\"type\":\"complete\"}"));
    }

    @Test
    void joinsMultipleDataLines() throws IOException {
        SseParser.Event ev = parser("data: {\"a\":1}\ndata: {\"b\":2}\n\n").next();

        assertThat(ev.data()).isEqualTo("{\"a\":1}\n{\"b\":2}");
    }

    @Test
    void skipsLeadingAndTrailingBlankLines() throws IOException {
        SseParser p = parser("\n\nevent: x\ndata: {}\n\n\n\n");

        assertThat(p.next()).isEqualTo(new SseParser.Event("x", "{}"));
        assertThat(p.next()).isNull();
    }

    @Test
    void flushesUnterminatedTrailingFrame() throws IOException {
        SseParser p = parser("data: first\n\ndata: {}\n");

        assertThat(p.next().data()).isEqualTo("first");
        assertThat(p.next().data()).isEqualTo("{}");
        assertThat(p.next()).isNull();
    }

    @Test
    void emptyStreamHasNoEvents() throws IOException {
        assertThat(parser("").next()).isNull();
    }

    @Test
    void ignoresUnknownFieldsAndComments() throws IOException {
        SseParser.Event ev = parser(": keep-alive\nid: 7\nretry: 3000\nfoo: bar\nevent: x\ndata: payload\n\n").next();

        assertThat(ev).isEqualTo(new SseParser.Event("x", "payload"));
    }

    @Test
    void lastEventLineWins() throws IOException {
        SseParser.Event ev = parser("event: a\nevent: b\ndata: 1\n\n").next();

        assertThat(ev.eventType()).isEqualTo("b");
    }

    @Test
    void eventLineWithoutDataCarriesIntoNextFrame() throws IOException {
        SseParser p = parser("event: orphan\n\ndata: 1\n\n");

        assertThat(p.next()).isEqualTo(new SseParser.Event("orphan", "1"));
        assertThat(p.next()).isNull();
    }

    @Test
    void prefixesAreExact() throws IOException {
        SseParser.Event ev = parser("data:nospace\nDATA: upper\ndata: kept\n\n").next();

        assertThat(ev.data()).isEqualTo("kept");
    }

    @Test
    void keepsCrLfFramesIntact() throws IOException {
        SseParser.Event ev = parser("event: x\r\ndata: a\r\ndata: b\r\n\r\n").next();

        assertThat(ev).isEqualTo(new SseParser.Event("x", "a\nb"));
    }

    @Test
    void handlesVeryLargeDataLinesWithAnyBufferSize() throws IOException {
        String payload = "{\"blob\":\"" + "y".repeat(2 * 1024 * 1024) + "\"}";
        String body = "event: big\ndata: " + payload + "\n\n";

        for (int size : new int[]{0, 16, 1024, 64 * 1024}) {
            SseParser p = new SseParser(new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)), size);
            SseParser.Event ev = p.next();

            assertThat(ev.eventType()).isEqualTo("big");
            assertThat(ev.data()).hasSize(payload.length()).isEqualTo(payload);
            assertThat(p.next()).isNull();
        }
    }

    @Test
    void wrapsTransportErrors() throws IOException {
        SseParser p = new SseParser(new FailingInputStream("data: 1\n\ndata: 2\n".getBytes(StandardCharsets.UTF_8)));

        assertThat(p.next().data()).isEqualTo("1");
        assertThatThrownBy(p::next)
                .isInstanceOf(StreamReadException.class)
                .hasMessage("failed reading stream")
                .hasRootCauseMessage("Connection reset");
    }

    @Test
    void rethrowsTimeoutUnwrapped() throws IOException {
        BlockingInputStream source = new BlockingInputStream("data: 1\n\n".getBytes(StandardCharsets.UTF_8));
        try (SseParser p = new SseParser(new TimeoutInputStream(source, Duration.ofMillis(50)))) {
            assertThatThrownBy(p::next)
                    .isInstanceOf(StreamReadTimeoutException.class)
                    .hasMessageContaining("50ms");
        }
        assertThat(source.closeCount()).isEqualTo(1);
    }
}
