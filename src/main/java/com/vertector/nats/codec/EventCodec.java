package com.vertector.nats.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vertector.nats.event.DomainEvent;

import java.io.IOException;

/**
 * JSON wire format of {@link DomainEvent}.
 *
 * <h2>Format</h2>
 * <ul>
 *   <li>snake_case property names ({@code event_id}, {@code source_service}).</li>
 *   <li>{@code java.time} values as ISO-8601 strings, never numeric timestamps.</li>
 *   <li>{@code event_type} property selects the record on decode.</li>
 *   <li>Unknown properties are ignored so older consumers can read newer producers.</li>
 * </ul>
 *
 * <p>The codec owns its own {@link ObjectMapper} so the wire format does not change
 * with the host application's Jackson settings. Instances are thread-safe.</p>
 */
public class EventCodec {

    private final ObjectWriter writer;
    private final ObjectReader reader;

    public EventCodec() {
        this(defaultMapper());
    }

    /** Uses a caller-provided mapper as is; it must be able to handle {@code java.time}. */
    public EventCodec(ObjectMapper mapper) {
        this.writer = mapper.writerFor(DomainEvent.class);
        this.reader = mapper.readerFor(DomainEvent.class);
    }

    /**
     * Mapper behind the default wire format.
     */
    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        return mapper;
    }

    /**
     * @throws EventEncodingException if the event cannot be serialized
     */
    public byte[] encode(DomainEvent event) {
        try {
            return writer.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new EventEncodingException(
                    "Failed to encode event id=" + event.eventId() + " type=" + event.eventType(), e);
        }
    }

    /**
     * @throws EventDecodingException if the payload is not a JSON object, names no known
     *                                event type, or violates a field constraint
     */
    public DomainEvent decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new EventDecodingException("Empty payload");
        }
        DomainEvent event;
        try {
            event = reader.readValue(payload);
        } catch (IOException e) {
            String reason = e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : e.getMessage();
            throw new EventDecodingException("Failed to decode event: " + reason, e);
        }
        if (event == null) {
            throw new EventDecodingException("Payload is JSON null");
        }
        return event;
    }
}
