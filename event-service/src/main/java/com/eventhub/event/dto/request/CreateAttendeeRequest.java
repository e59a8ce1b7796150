package com.eventhub.event.dto.request;

import com.eventhub.common.util.Sanitizers;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateAttendeeRequest(
        @NotBlank(message = "must not be blank")
        @Size(max = Sanitizers.MAX_TEXT_LENGTH, message = "must be at most 5000 characters")
        String name,

        @NotBlank(message = "must not be blank")
        @Pattern(regexp = ContactPatterns.EMAIL, message = "must be a valid email address")
        String email,

        @Pattern(regexp = ContactPatterns.PHONE, message = "must be a valid phone number")
        String phone
) {
    public CreateAttendeeRequest normalized() {
        return new CreateAttendeeRequest(Sanitizers.text(name), Sanitizers.text(email), Sanitizers.text(phone));
    }
}
