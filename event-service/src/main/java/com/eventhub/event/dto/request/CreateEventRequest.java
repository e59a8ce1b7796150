package com.eventhub.event.dto.request;

import com.eventhub.common.util.Sanitizers;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;

public record CreateEventRequest(
        @NotBlank(message = "must not be blank")
        @Size(max = Sanitizers.MAX_TEXT_LENGTH, message = "must be at most 5000 characters")
        String name,

        @Size(max = Sanitizers.MAX_TEXT_LENGTH, message = "must be at most 5000 characters")
        String description,

        @NotNull(message = "is required")
        LocalDateTime date,

        @NotBlank(message = "must not be blank")
        String venueId,

        @NotNull(message = "is required")
        @Positive(message = "must be a positive integer")
        Integer capacity
) {
    public CreateEventRequest normalized() {
        return new CreateEventRequest(Sanitizers.text(name), Sanitizers.text(description), date,
                Sanitizers.text(venueId), capacity);
    }
}
