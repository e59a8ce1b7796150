package com.eventhub.event.service;

import com.eventhub.common.exception.ValidationException;
import com.eventhub.event.domain.EntityKind;
import com.eventhub.event.domain.Event;
import com.eventhub.event.dto.request.CreateEventRequest;
import com.eventhub.event.dto.request.UpdateEventRequest;
import com.eventhub.event.dto.response.AvailabilityResponse;
import com.eventhub.event.dto.response.EventResponse;
import com.eventhub.event.integrity.ReferentialIntegrityService;
import com.eventhub.event.repository.EventRepository;
import com.eventhub.event.validation.EntityValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class EventService {

    private final EventRepository eventRepository;
    private final EntityValidator entityValidator;
    private final ReferentialIntegrityService integrityService;
    private final CapacityLedger capacityLedger;
    private final EntityLockService entityLockService;

    /**
     * Holds the venue lock so the venue cannot be deleted or shrunk between the
     * placement check and the insert.
     */
    public EventResponse createEvent(CreateEventRequest request) {
        CreateEventRequest valid = entityValidator.validate(EntityKind.EVENT, request.normalized());

        List<RLock> locks = entityLockService.acquireLocks(List.of(EntityKind.VENUE.lockKey(valid.venueId())));
        try {
            integrityService.verifyEventPlacement(valid.venueId(), valid.capacity());

            Event event = eventRepository.save(Event.builder()
                    .name(valid.name())
                    .description(valid.description())
                    .date(valid.date())
                    .venueId(valid.venueId())
                    .capacity(valid.capacity())
                    .build());

            log.info("Event created: eventId={}, venueId={}, capacity={}",
                    event.getId(), event.getVenueId(), event.getCapacity());
            return EventResponse.from(event);
        } finally {
            entityLockService.releaseLocks(locks);
        }
    }

    public EventResponse getEvent(String eventId) {
        return EventResponse.from(integrityService.requireEvent(eventId));
    }

    public List<EventResponse> getEvents() {
        return eventRepository.findAll(Sort.by("id")).stream()
                .map(EventResponse::from)
                .toList();
    }

    public AvailabilityResponse getAvailability(String eventId) {
        Event event = integrityService.requireEvent(eventId);
        return AvailabilityResponse.from(capacityLedger.availability(event));
    }

    /**
     * Venue and capacity changes are re-checked against the target venue and against the
     * seats already booked. The event lock is taken first; the venue lock is only needed
     * (and only taken) when one of those fields is touched.
     */
    public EventResponse updateEvent(String eventId, UpdateEventRequest request) {
        UpdateEventRequest valid = entityValidator.validate(EntityKind.EVENT, request.normalized());

        List<RLock> eventLocks = entityLockService.acquireLocks(List.of(EntityKind.EVENT.lockKey(eventId)));
        try {
            Event event = integrityService.requireEvent(eventId);

            if (valid.venueId() == null && valid.capacity() == null) {
                event.update(valid.name(), valid.description(), valid.date());
                return saveUpdated(event);
            }

            String venueId = valid.venueId() != null ? valid.venueId() : event.getVenueId();
            List<RLock> venueLocks = entityLockService.acquireLocks(List.of(EntityKind.VENUE.lockKey(venueId)));
            try {
                int capacity = valid.capacity() != null ? valid.capacity() : event.getCapacity();
                integrityService.verifyEventPlacement(venueId, capacity);

                if (valid.capacity() != null) {
                    int booked = capacityLedger.bookedSeats(eventId);
                    if (capacity < booked) {
                        throw new ValidationException("capacity",
                                "must be at least " + booked + " to cover seats already booked");
                    }
                }

                event.moveTo(venueId);
                event.changeCapacity(capacity);
                event.update(valid.name(), valid.description(), valid.date());
                return saveUpdated(event);
            } finally {
                entityLockService.releaseLocks(venueLocks);
            }
        } finally {
            entityLockService.releaseLocks(eventLocks);
        }
    }

    public void deleteEvent(String eventId) {
        List<RLock> locks = entityLockService.acquireLocks(List.of(EntityKind.EVENT.lockKey(eventId)));
        try {
            integrityService.requireEvent(eventId);
            integrityService.verifyDelete(EntityKind.EVENT, eventId);
            eventRepository.deleteById(eventId);
            log.info("Event deleted: eventId={}", eventId);
        } finally {
            entityLockService.releaseLocks(locks);
        }
    }

    private EventResponse saveUpdated(Event event) {
        Event saved = eventRepository.save(event);
        log.info("Event updated: eventId={}, venueId={}, capacity={}",
                saved.getId(), saved.getVenueId(), saved.getCapacity());
        return EventResponse.from(saved);
    }
}
