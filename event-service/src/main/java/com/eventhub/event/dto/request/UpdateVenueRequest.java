package com.eventhub.event.dto.request;

import com.eventhub.common.util.Sanitizers;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Partial update: null fields are left untouched.
 */
public record UpdateVenueRequest(
        @Size(min = 1, max = Sanitizers.MAX_TEXT_LENGTH, message = "must be between 1 and 5000 characters")
        String name,

        @Size(min = 1, max = Sanitizers.MAX_TEXT_LENGTH, message = "must be between 1 and 5000 characters")
        String address,

        @Positive(message = "must be a positive integer")
        Integer capacity
) {
    public UpdateVenueRequest normalized() {
        return new UpdateVenueRequest(Sanitizers.text(name), Sanitizers.text(address), capacity);
    }
}
