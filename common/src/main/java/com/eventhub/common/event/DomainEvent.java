package com.eventhub.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Envelope shared by every lifecycle message the service publishes.
 * <p>
 * {@code eventId} identifies the message itself (consumers dedupe on it) and is unrelated
 * to the id of any Event document. Each subtype routes itself to one of the {@link Topics}.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class DomainEvent {

    private String eventId;
    private String eventType;
    private Instant occurredAt;

    protected DomainEvent(String eventType) {
        this.eventId = UUID.randomUUID().toString();
        this.eventType = eventType;
        this.occurredAt = Instant.now();
    }

    /**
     * Destination topic for this message, derived from its type.
     */
    public abstract String topic();
}
