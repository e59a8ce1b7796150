package com.eventhub.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Booking lifecycle notification. {@code targetEventId} is the booked Event, not to be
 * confused with {@link #getEventId()} which identifies this message.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEvent extends DomainEvent {

    public static final String TYPE_CREATED = "BOOKING_CREATED";
    public static final String TYPE_UPDATED = "BOOKING_UPDATED";
    public static final String TYPE_CANCELLED = "BOOKING_CANCELLED";

    private String bookingId;
    private String targetEventId;
    private String attendeeId;
    private int seatCount;

    private BookingEvent(String eventType, String bookingId, String targetEventId,
                         String attendeeId, int seatCount) {
        super(eventType);
        this.bookingId = bookingId;
        this.targetEventId = targetEventId;
        this.attendeeId = attendeeId;
        this.seatCount = seatCount;
    }

    @Override
    public String topic() {
        return switch (getEventType()) {
            case TYPE_CREATED -> Topics.BOOKING_CREATED;
            case TYPE_UPDATED -> Topics.BOOKING_UPDATED;
            case TYPE_CANCELLED -> Topics.BOOKING_CANCELLED;
            default -> throw new IllegalStateException("Unknown booking event type: " + getEventType());
        };
    }

    public static BookingEvent created(String bookingId, String targetEventId, String attendeeId, int seatCount) {
        return new BookingEvent(TYPE_CREATED, bookingId, targetEventId, attendeeId, seatCount);
    }

    public static BookingEvent updated(String bookingId, String targetEventId, String attendeeId, int seatCount) {
        return new BookingEvent(TYPE_UPDATED, bookingId, targetEventId, attendeeId, seatCount);
    }

    public static BookingEvent cancelled(String bookingId, String targetEventId, String attendeeId, int seatCount) {
        return new BookingEvent(TYPE_CANCELLED, bookingId, targetEventId, attendeeId, seatCount);
    }
}
