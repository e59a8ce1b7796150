package com.eventhub.event.service;

public record Availability(String eventId, int capacity, int bookedSeats) {

    public int remaining() {
        return Math.max(capacity - bookedSeats, 0);
    }
}
