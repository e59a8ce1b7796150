package com.eventhub.event.dto.request;

import com.eventhub.common.util.Sanitizers;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Partial update: null fields are left untouched. Changing eventId or seatCount
 * goes back through the capacity check.
 */
public record UpdateBookingRequest(
        @Size(min = 1, message = "must not be blank")
        String eventId,

        @Size(min = 1, message = "must not be blank")
        String attendeeId,

        @Positive(message = "must be a positive integer")
        Integer seatCount,

        @Size(min = 1, max = 100, message = "must be between 1 and 100 characters")
        String ticketType
) {
    public UpdateBookingRequest normalized() {
        return new UpdateBookingRequest(Sanitizers.text(eventId), Sanitizers.text(attendeeId), seatCount,
                Sanitizers.text(ticketType));
    }
}
