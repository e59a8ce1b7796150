package com.eventhub.event.dto.request;

import com.eventhub.common.util.Sanitizers;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record CreateBookingRequest(
        @NotBlank(message = "must not be blank")
        String eventId,

        @NotBlank(message = "must not be blank")
        String attendeeId,

        @NotNull(message = "is required")
        @Positive(message = "must be a positive integer")
        Integer seatCount,

        @Size(min = 1, max = 100, message = "must be between 1 and 100 characters")
        String ticketType
) {
    public CreateBookingRequest normalized() {
        return new CreateBookingRequest(Sanitizers.text(eventId), Sanitizers.text(attendeeId), seatCount,
                Sanitizers.text(ticketType));
    }
}
