package com.eventhub.event.dto.response;

import com.eventhub.event.domain.Event;

import java.time.Instant;
import java.time.LocalDateTime;

public record EventResponse(
        String id,
        String name,
        String description,
        LocalDateTime date,
        String venueId,
        int capacity,
        String posterRef,
        String promoVideoRef,
        Instant createdAt,
        Instant updatedAt
) {
    public static EventResponse from(Event event) {
        return new EventResponse(
                event.getId(),
                event.getName(),
                event.getDescription(),
                event.getDate(),
                event.getVenueId(),
                event.getCapacity(),
                event.getPosterRef(),
                event.getPromoVideoRef(),
                event.getCreatedAt(),
                event.getUpdatedAt()
        );
    }
}
