package com.eventhub.event.dto.response;

import com.eventhub.event.domain.Booking;

import java.time.Instant;

public record BookingResponse(
        String id,
        String eventId,
        String attendeeId,
        int seatCount,
        String ticketType,
        Instant createdAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getEventId(),
                booking.getAttendeeId(),
                booking.getSeatCount(),
                booking.getTicketType(),
                booking.getCreatedAt()
        );
    }
}
