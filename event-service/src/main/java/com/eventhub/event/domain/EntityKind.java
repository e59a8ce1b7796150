package com.eventhub.event.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum EntityKind {

    VENUE("venue", "venues"),
    EVENT("event", "events"),
    ATTENDEE("attendee", "attendees"),
    BOOKING("booking", "bookings");

    private static final String LOCK_PREFIX = "lock:";

    private final String label;
    private final String collection;

    public String lockKey(String id) {
        return LOCK_PREFIX + label + ":" + id;
    }
}
