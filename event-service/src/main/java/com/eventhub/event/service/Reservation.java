package com.eventhub.event.service;

/**
 * An admitted capacity decision: {@code seatCount} seats fit on top of {@code bookedBefore}.
 */
public record Reservation(String eventId, int seatCount, int bookedBefore, int capacity) {

    public int remainingAfter() {
        return capacity - bookedBefore - seatCount;
    }
}
