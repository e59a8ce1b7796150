package com.eventhub.event.integrity;

import com.eventhub.common.exception.BusinessException;
import com.eventhub.common.exception.ConflictException;
import com.eventhub.common.exception.ReferenceException;
import com.eventhub.common.exception.ValidationException;
import com.eventhub.common.response.ErrorCode;
import com.eventhub.event.domain.Attendee;
import com.eventhub.event.domain.Booking;
import com.eventhub.event.domain.EntityKind;
import com.eventhub.event.domain.Event;
import com.eventhub.event.domain.Venue;
import com.eventhub.event.repository.AttendeeRepository;
import com.eventhub.event.repository.BookingRepository;
import com.eventhub.event.repository.EventRepository;
import com.eventhub.event.repository.VenueRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Application-level foreign keys over a store that enforces none.
 * <p>
 * {@code resolve*} methods check references carried in a payload and fail with
 * {@link ReferenceException}. {@code require*} methods look a document up by its own id
 * and fail with a not-found {@link BusinessException}. Deletes follow a restrict policy:
 * a document with live dependents is never removed.
 * <p>
 * Callers hold the entity locks covering the documents involved, so a verified reference
 * stays valid until their write lands.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferentialIntegrityService {

    private final VenueRepository venueRepository;
    private final EventRepository eventRepository;
    private final AttendeeRepository attendeeRepository;
    private final BookingRepository bookingRepository;

    public Venue resolveVenue(String field, String venueId) {
        return venueRepository.findById(venueId)
                .orElseThrow(() -> new ReferenceException(field, venueId));
    }

    public Event resolveEvent(String field, String eventId) {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> new ReferenceException(field, eventId));
    }

    public Attendee resolveAttendee(String field, String attendeeId) {
        return attendeeRepository.findById(attendeeId)
                .orElseThrow(() -> new ReferenceException(field, attendeeId));
    }

    /**
     * An event may only be placed at an existing venue large enough to hold it.
     */
    public Venue verifyEventPlacement(String venueId, int capacity) {
        Venue venue = resolveVenue("venueId", venueId);
        if (capacity > venue.getCapacity()) {
            throw new ValidationException("capacity",
                    "must not exceed venue capacity of " + venue.getCapacity());
        }
        return venue;
    }

    /**
     * Resolves both booking references, event first, failing on the first dangling one.
     */
    public Event verifyBookingReferences(String eventId, String attendeeId) {
        Event event = resolveEvent("eventId", eventId);
        resolveAttendee("attendeeId", attendeeId);
        return event;
    }

    public void verifyDelete(EntityKind kind, String id) {
        List<String> dependentIds = switch (kind) {
            case VENUE -> eventRepository.findByVenueIdOrderByIdAsc(id).stream()
                    .map(Event::getId)
                    .toList();
            case EVENT -> bookingRepository.findByEventIdOrderByIdAsc(id).stream()
                    .map(Booking::getId)
                    .toList();
            case ATTENDEE -> bookingRepository.findByAttendeeIdOrderByIdAsc(id).stream()
                    .map(Booking::getId)
                    .toList();
            case BOOKING -> List.of();
        };

        if (!dependentIds.isEmpty()) {
            EntityKind dependentKind = kind == EntityKind.VENUE ? EntityKind.EVENT : EntityKind.BOOKING;
            log.info("Delete restricted: {}={} still referenced by {} {}",
                    kind.getLabel(), id, dependentIds.size(), dependentKind.getCollection());
            throw new ConflictException(dependentKind.getCollection(), dependentIds);
        }
    }

    public Venue requireVenue(String venueId) {
        return venueRepository.findById(venueId)
                .orElseThrow(() -> new BusinessException(ErrorCode.VENUE_NOT_FOUND,
                        "Venue not found: " + venueId));
    }

    public Event requireEvent(String eventId) {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND,
                        "Event not found: " + eventId));
    }

    public Attendee requireAttendee(String attendeeId) {
        return attendeeRepository.findById(attendeeId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ATTENDEE_NOT_FOUND,
                        "Attendee not found: " + attendeeId));
    }

    public Booking requireBooking(String bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND,
                        "Booking not found: " + bookingId));
    }
}
