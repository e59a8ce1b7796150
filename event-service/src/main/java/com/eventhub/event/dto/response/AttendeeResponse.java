package com.eventhub.event.dto.response;

import com.eventhub.event.domain.Attendee;

import java.time.Instant;

public record AttendeeResponse(
        String id,
        String name,
        String email,
        String phone,
        Instant registeredAt
) {
    public static AttendeeResponse from(Attendee attendee) {
        return new AttendeeResponse(
                attendee.getId(),
                attendee.getName(),
                attendee.getEmail(),
                attendee.getPhone(),
                attendee.getCreatedAt()
        );
    }
}
