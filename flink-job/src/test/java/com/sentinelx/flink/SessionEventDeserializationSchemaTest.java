package com.sentinelx.flink;

import com.sentinelx.core.model.EventKind;
import com.sentinelx.core.model.InteractionEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SessionEventDeserializationSchema}.
 */
class SessionEventDeserializationSchemaTest {

    private final SessionEventDeserializationSchema schema = new SessionEventDeserializationSchema();

    @Test
    @DisplayName("Flat message yields session id and event")
    void shouldDeserializeMouseMove() throws IOException {
        SessionEvent result = schema.deserialize(bytes(
                "{\"session_id\":\"s-1\",\"timestamp\":100.5,\"type\":\"mouse_move\",\"x\":10,\"y\":20}"));

        assertThat(result).isNotNull();
        assertThat(result.getSessionId()).isEqualTo("s-1");
        assertThat(result.getEvent()).isEqualTo(InteractionEvent.mouseMove(100.5, 10, 20));
    }

    @Test
    @DisplayName("Idle period keeps its duration and unknown fields are ignored")
    void shouldDeserializeIdlePeriod() throws IOException {
        SessionEvent result = schema.deserialize(bytes(
                "{\"session_id\":\"s-2\",\"timestamp\":5.0,\"type\":\"idle_period\",\"duration\":3.5,\"extra\":true}"));

        assertThat(result.getEvent().getKind()).isEqualTo(EventKind.IDLE_PERIOD);
        assertThat(result.getEvent().getDuration()).isEqualTo(3.5);
    }

    @Test
    @DisplayName("Missing or blank session id drops the message")
    void shouldDropWithoutSession() throws IOException {
        assertThat(schema.deserialize(bytes("{\"timestamp\":1.0,\"type\":\"key_press\"}"))).isNull();
        assertThat(schema.deserialize(bytes("{\"session_id\":\" \",\"timestamp\":1.0,\"type\":\"key_press\"}")))
                .isNull();
    }

    @Test
    @DisplayName("Malformed, unknown-kind and empty messages are dropped")
    void shouldDropMalformed() throws IOException {
        assertThat(schema.deserialize(bytes("{not json"))).isNull();
        assertThat(schema.deserialize(bytes("[1,2,3]"))).isNull();
        assertThat(schema.deserialize(bytes("{\"session_id\":\"s\",\"timestamp\":1.0,\"type\":\"keystroke_text\"}")))
                .isNull();
        assertThat(schema.deserialize(new byte[0])).isNull();
        assertThat(schema.deserialize(null)).isNull();
    }

    @Test
    @DisplayName("Stream never ends")
    void shouldBeUnbounded() {
        assertThat(schema.isEndOfStream(null)).isFalse();
        assertThat(schema.getProducedType().getTypeClass()).isEqualTo(SessionEvent.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
