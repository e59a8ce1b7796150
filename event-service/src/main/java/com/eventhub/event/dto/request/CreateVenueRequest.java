package com.eventhub.event.dto.request;

import com.eventhub.common.util.Sanitizers;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record CreateVenueRequest(
        @NotBlank(message = "must not be blank")
        @Size(max = Sanitizers.MAX_TEXT_LENGTH, message = "must be at most 5000 characters")
        String name,

        @NotBlank(message = "must not be blank")
        @Size(max = Sanitizers.MAX_TEXT_LENGTH, message = "must be at most 5000 characters")
        String address,

        @NotNull(message = "is required")
        @Positive(message = "must be a positive integer")
        Integer capacity
) {
    public CreateVenueRequest normalized() {
        return new CreateVenueRequest(Sanitizers.text(name), Sanitizers.text(address), capacity);
    }
}
