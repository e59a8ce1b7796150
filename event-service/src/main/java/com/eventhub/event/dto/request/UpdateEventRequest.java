package com.eventhub.event.dto.request;

import com.eventhub.common.util.Sanitizers;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;

/**
 * Partial update: null fields are left untouched.
 */
public record UpdateEventRequest(
        @Size(min = 1, max = Sanitizers.MAX_TEXT_LENGTH, message = "must be between 1 and 5000 characters")
        String name,

        @Size(max = Sanitizers.MAX_TEXT_LENGTH, message = "must be at most 5000 characters")
        String description,

        LocalDateTime date,

        @Size(min = 1, message = "must not be blank")
        String venueId,

        @Positive(message = "must be a positive integer")
        Integer capacity
) {
    public UpdateEventRequest normalized() {
        return new UpdateEventRequest(Sanitizers.text(name), Sanitizers.text(description), date,
                Sanitizers.text(venueId), capacity);
    }
}
