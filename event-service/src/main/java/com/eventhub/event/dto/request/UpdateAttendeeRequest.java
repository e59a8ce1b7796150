package com.eventhub.event.dto.request;

import com.eventhub.common.util.Sanitizers;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update: null fields are left untouched.
 */
public record UpdateAttendeeRequest(
        @Size(min = 1, max = Sanitizers.MAX_TEXT_LENGTH, message = "must be between 1 and 5000 characters")
        String name,

        @Pattern(regexp = ContactPatterns.EMAIL, message = "must be a valid email address")
        String email,

        @Pattern(regexp = ContactPatterns.PHONE, message = "must be a valid phone number")
        String phone
) {
    public UpdateAttendeeRequest normalized() {
        return new UpdateAttendeeRequest(Sanitizers.text(name), Sanitizers.text(email), Sanitizers.text(phone));
    }
}
