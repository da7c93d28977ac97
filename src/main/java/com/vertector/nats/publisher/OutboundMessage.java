package com.vertector.nats.publisher;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A fully prepared stream write.
 *
 * @param subject   routing subject, the event type
 * @param payload   encoded event
 * @param headers   headers to attach, identity headers included
 * @param messageId de-duplication id, the event id
 */
public record OutboundMessage(String subject, byte[] payload, Map<String, String> headers, String messageId) {

    public OutboundMessage {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(payload, "payload");
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }
}
