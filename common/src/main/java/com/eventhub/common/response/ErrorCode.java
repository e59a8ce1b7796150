package com.eventhub.common.response;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(400, "C001", "Invalid input"),
    RESOURCE_NOT_FOUND(404, "C002", "Resource not found"),
    INTERNAL_ERROR(500, "C003", "Internal server error"),
    SERVICE_UNAVAILABLE(503, "C004", "Service temporarily unavailable"),
    METHOD_NOT_ALLOWED(405, "C005", "Method not allowed"),

    // Integrity
    REFERENCE_NOT_FOUND(404, "R001", "Referenced resource does not exist"),
    DELETE_RESTRICTED(409, "R002", "Resource is still referenced"),

    // Venue
    VENUE_NOT_FOUND(404, "V001", "Venue not found"),

    // Event
    EVENT_NOT_FOUND(404, "E001", "Event not found"),

    // Attendee
    ATTENDEE_NOT_FOUND(404, "A001", "Attendee not found"),

    // Booking
    BOOKING_NOT_FOUND(404, "B001", "Booking not found"),
    CAPACITY_EXCEEDED(409, "B002", "Not enough capacity left"),
    LOCK_ACQUISITION_FAILED(503, "B003", "Failed to acquire lock"),

    // Media
    MEDIA_NOT_FOUND(404, "M001", "Media not found");

    private final int status;
    private final String code;
    private final String message;
}
