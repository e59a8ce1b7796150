package com.eventhub.event.dto.response;

import com.eventhub.event.service.Availability;

public record AvailabilityResponse(
        String eventId,
        int capacity,
        int bookedSeats,
        int remainingSeats
) {
    public static AvailabilityResponse from(Availability availability) {
        return new AvailabilityResponse(
                availability.eventId(),
                availability.capacity(),
                availability.bookedSeats(),
                availability.remaining()
        );
    }
}
