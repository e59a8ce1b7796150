package com.eventhub.event.dto.response;

import com.eventhub.event.domain.Venue;

import java.time.Instant;

public record VenueResponse(
        String id,
        String name,
        String address,
        int capacity,
        String photoRef,
        Instant createdAt,
        Instant updatedAt
) {
    public static VenueResponse from(Venue venue) {
        return new VenueResponse(
                venue.getId(),
                venue.getName(),
                venue.getAddress(),
                venue.getCapacity(),
                venue.getPhotoRef(),
                venue.getCreatedAt(),
                venue.getUpdatedAt()
        );
    }
}
