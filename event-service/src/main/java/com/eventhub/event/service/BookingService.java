package com.eventhub.event.service;

import com.eventhub.common.exception.BusinessException;
import com.eventhub.common.response.ErrorCode;
import com.eventhub.event.domain.Booking;
import com.eventhub.event.domain.EntityKind;
import com.eventhub.event.domain.Event;
import com.eventhub.event.dto.request.CreateBookingRequest;
import com.eventhub.event.dto.request.UpdateBookingRequest;
import com.eventhub.event.dto.response.BookingResponse;
import com.eventhub.event.integrity.ReferentialIntegrityService;
import com.eventhub.event.messaging.DomainEventProducer;
import com.eventhub.event.repository.BookingRepository;
import com.eventhub.event.validation.EntityValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Booking lifecycle. Every capacity decision for an event runs under that event's lock:
 * <ol>
 *   <li>resolve references (event before attendee)</li>
 *   <li>recompute booked seats and admit or reject</li>
 *   <li>write the booking in a single insert</li>
 * </ol>
 * A rejected request writes nothing. Lifecycle events go out after the locks are released.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private static final int MAX_LOCK_ATTEMPTS = 3;

    private final BookingRepository bookingRepository;
    private final EntityValidator entityValidator;
    private final ReferentialIntegrityService integrityService;
    private final CapacityLedger capacityLedger;
    private final EntityLockService entityLockService;
    private final DomainEventProducer domainEventProducer;

    public BookingResponse createBooking(CreateBookingRequest request) {
        CreateBookingRequest valid = entityValidator.validate(EntityKind.BOOKING, request.normalized());
        log.info("Create booking: eventId={}, attendeeId={}, seats={}",
                valid.eventId(), valid.attendeeId(), valid.seatCount());

        Booking booking;
        List<RLock> locks = entityLockService.acquireLocks(List.of(
                EntityKind.EVENT.lockKey(valid.eventId()),
                EntityKind.ATTENDEE.lockKey(valid.attendeeId())));
        try {
            Event event = integrityService.verifyBookingReferences(valid.eventId(), valid.attendeeId());
            Reservation reservation = capacityLedger.reserve(event, valid.seatCount());

            booking = bookingRepository.save(Booking.builder()
                    .eventId(valid.eventId())
                    .attendeeId(valid.attendeeId())
                    .seatCount(valid.seatCount())
                    .ticketType(valid.ticketType())
                    .build());

            log.info("Booking created: bookingId={}, eventId={}, seats={}, remaining={}",
                    booking.getId(), booking.getEventId(), booking.getSeatCount(), reservation.remainingAfter());
        } finally {
            entityLockService.releaseLocks(locks);
        }

        domainEventProducer.publishBookingCreated(booking);
        return BookingResponse.from(booking);
    }

    public BookingResponse getBooking(String bookingId) {
        return BookingResponse.from(integrityService.requireBooking(bookingId));
    }

    public List<BookingResponse> getBookings() {
        return bookingRepository.findAll(Sort.by("id")).stream()
                .map(BookingResponse::from)
                .toList();
    }

    /**
     * A seat count or event change is a release-then-reserve: the booking's own seats are
     * not counted against the target event, and on rejection the booking is left as it was.
     */
    public BookingResponse updateBooking(String bookingId, UpdateBookingRequest request) {
        UpdateBookingRequest valid = entityValidator.validate(EntityKind.BOOKING, request.normalized());

        Booking booking;
        LockedBooking locked = lockBooking(bookingId, snapshot -> updateLockKeys(snapshot, valid));
        try {
            booking = locked.booking();

            Event targetEvent = valid.eventId() != null
                    ? integrityService.resolveEvent("eventId", valid.eventId())
                    : null;
            if (valid.attendeeId() != null) {
                integrityService.resolveAttendee("attendeeId", valid.attendeeId());
            }

            boolean eventChanged = targetEvent != null && !booking.isFor(targetEvent.getId());
            if (eventChanged || valid.seatCount() != null) {
                if (targetEvent == null) {
                    targetEvent = integrityService.resolveEvent("eventId", booking.getEventId());
                }
                int seatCount = valid.seatCount() != null ? valid.seatCount() : booking.getSeatCount();
                capacityLedger.reserveReplacing(targetEvent, booking, seatCount);
                booking.moveTo(targetEvent.getId());
                booking.resize(seatCount);
            }
            if (valid.attendeeId() != null) {
                booking.transferTo(valid.attendeeId());
            }
            if (valid.ticketType() != null) {
                booking.changeTicketType(valid.ticketType());
            }

            booking = bookingRepository.save(booking);
            log.info("Booking updated: bookingId={}, eventId={}, seats={}",
                    booking.getId(), booking.getEventId(), booking.getSeatCount());
        } finally {
            entityLockService.releaseLocks(locked.locks());
        }

        domainEventProducer.publishBookingUpdated(booking);
        return BookingResponse.from(booking);
    }

    /**
     * Cancels a booking by deleting it, which returns its seats to the event.
     */
    public void deleteBooking(String bookingId) {
        LockedBooking locked = lockBooking(bookingId,
                snapshot -> List.of(EntityKind.EVENT.lockKey(snapshot.getEventId())));
        try {
            capacityLedger.release(locked.booking());
        } finally {
            entityLockService.releaseLocks(locked.locks());
        }

        domainEventProducer.publishBookingCancelled(locked.booking());
    }

    /**
     * The event to lock is only known after reading the booking, so the booking is re-read
     * under the locks. If it moved to another event in between, the locks are retaken.
     */
    private LockedBooking lockBooking(String bookingId, Function<Booking, Collection<String>> lockKeys) {
        for (int attempt = 1; attempt <= MAX_LOCK_ATTEMPTS; attempt++) {
            Booking snapshot = integrityService.requireBooking(bookingId);
            List<RLock> locks = entityLockService.acquireLocks(lockKeys.apply(snapshot));

            Booking current;
            try {
                current = integrityService.requireBooking(bookingId);
            } catch (RuntimeException e) {
                entityLockService.releaseLocks(locks);
                throw e;
            }
            if (current.isFor(snapshot.getEventId())) {
                return new LockedBooking(current, locks);
            }

            log.debug("Booking moved while locking: bookingId={}, attempt={}", bookingId, attempt);
            entityLockService.releaseLocks(locks);
        }
        throw new BusinessException(ErrorCode.LOCK_ACQUISITION_FAILED,
                "Booking changed concurrently, please retry: " + bookingId);
    }

    private static Collection<String> updateLockKeys(Booking snapshot, UpdateBookingRequest request) {
        List<String> keys = new ArrayList<>();
        keys.add(EntityKind.EVENT.lockKey(snapshot.getEventId()));
        if (request.eventId() != null) {
            keys.add(EntityKind.EVENT.lockKey(request.eventId()));
        }
        if (request.attendeeId() != null) {
            keys.add(EntityKind.ATTENDEE.lockKey(request.attendeeId()));
        }
        return keys;
    }

    private record LockedBooking(Booking booking, List<RLock> locks) {
    }
}
