package com.vertector.nats.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Correlation and tracing context carried by every event.
 *
 * <p>Purely descriptive: nothing in the publisher or consumer routes or retries on
 * these values. {@code sourceService} is the only required field and is copied into
 * the {@code source-service} header on publish.</p>
 *
 * @param sourceService service that produced the event
 * @param correlationId id linking related events, copied into {@code correlation-id}
 * @param causationId   id of the event that caused this one
 * @param userId        actor that triggered the event
 * @param institutionId tenant identifier
 * @param traceContext  free-form propagation context (e.g. W3C trace headers)
 */
public record EventMetadata(
        String sourceService,
        String correlationId,
        String causationId,
        String userId,
        String institutionId,
        Map<String, Object> traceContext
) {

    public EventMetadata {
        if (sourceService == null || sourceService.isBlank()) {
            throw new IllegalArgumentException("metadata.sourceService is required");
        }
        traceContext = traceContext == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(traceContext));
    }

    public static EventMetadata of(String sourceService) {
        return new EventMetadata(sourceService, null, null, null, null, null);
    }

    public EventMetadata withCorrelationId(String newCorrelationId) {
        return new EventMetadata(sourceService, newCorrelationId, causationId, userId, institutionId, traceContext);
    }

    public EventMetadata withCausationId(String newCausationId) {
        return new EventMetadata(sourceService, correlationId, newCausationId, userId, institutionId, traceContext);
    }

    public EventMetadata withUserId(String newUserId) {
        return new EventMetadata(sourceService, correlationId, causationId, newUserId, institutionId, traceContext);
    }

    public EventMetadata withInstitutionId(String newInstitutionId) {
        return new EventMetadata(sourceService, correlationId, causationId, userId, newInstitutionId, traceContext);
    }
}
