package com.vertector.nats.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vertector.nats.event.CourseCreatedEvent;
import com.vertector.nats.event.DomainEvent;
import com.vertector.nats.event.EventCatalog;
import com.vertector.nats.event.ExamCreatedEvent;
import com.vertector.nats.testing.TestEvents;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventCodecTest {

    private final EventCodec codec = new EventCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    static List<DomainEvent> catalog() {
        return TestEvents.oneOfEach();
    }

    @ParameterizedTest(name = "{index}: {0}")
    @MethodSource("catalog")
    void decodesWhatItEncodes(DomainEvent event) {
        DomainEvent decoded = codec.decode(codec.encode(event));

        assertThat(decoded).isEqualTo(event);
        assertThat(decoded.getClass()).isEqualTo(event.getClass());
    }

    @Test
    void sampleCoversTheWholeCatalog() {
        assertThat(TestEvents.oneOfEach().stream().map(DomainEvent::eventType).collect(Collectors.toSet()))
                .containsExactlyInAnyOrderElementsOf(EventCatalog.types());
    }

    @Test
    void wireFormatUsesSnakeCaseAndIsoTimestamps() throws Exception {
        CourseCreatedEvent event = TestEvents.course("CS101");

        JsonNode json = mapper.readTree(codec.encode(event));

        assertThat(json.get("event_type").asText()).isEqualTo("academic.course.created");
        assertThat(json.get("event_id").asText()).isEqualTo(event.eventId().toString());
        assertThat(json.get("event_version").asText()).isEqualTo("1.0");
        assertThat(json.get("timestamp").isTextual()).isTrue();
        assertThat(json.get("timestamp").asText()).isEqualTo("2025-01-15T10:30:00.123456Z");
        assertThat(json.get("metadata").get("source_service").asText()).isEqualTo("test-service");
        assertThat(json.get("course_id").asText()).isEqualTo("CS101");
        assertThat(json.has("eventType")).isFalse();
    }

    @Test
    void unknownPropertiesAreIgnored() throws Exception {
        ExamCreatedEvent event = TestEvents.exam("EX-1");
        ObjectNode json =
                (ObjectNode) mapper.readTree(codec.encode(event));
        json.put("added_in_a_later_version", true);

        assertThat(codec.decode(mapper.writeValueAsBytes(json))).isEqualTo(event);
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> codec.decode("{\"event_type\":".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(EventDecodingException.class);
    }

    @Test
    void rejectsEmptyPayload() {
        assertThatThrownBy(() -> codec.decode(new byte[0]))
                .isInstanceOf(EventDecodingException.class)
                .hasMessageContaining("Empty payload");
        assertThatThrownBy(() -> codec.decode(null))
                .isInstanceOf(EventDecodingException.class);
    }

    @Test
    void rejectsJsonNull() {
        assertThatThrownBy(() -> codec.decode("null".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(EventDecodingException.class)
                .hasMessageContaining("JSON null");
        assertThatThrownBy(() -> codec.decode(" null\n".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(EventDecodingException.class);
    }

    @Test
    void rejectsUnknownEventType() {
        byte[] payload = "{\"event_type\":\"academic.unknown.thing\",\"metadata\":{\"source_service\":\"x\"}}"
                .getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> codec.decode(payload)).isInstanceOf(EventDecodingException.class);
    }

    @Test
    void rejectsEventMissingARequiredField() throws Exception {
        ObjectNode json =
                (ObjectNode) mapper.readTree(codec.encode(TestEvents.course("CS101")));
        json.remove("course_id");

        assertThatThrownBy(() -> codec.decode(mapper.writeValueAsBytes(json)))
                .isInstanceOf(EventDecodingException.class)
                .hasMessageContaining("courseId");
    }
}
