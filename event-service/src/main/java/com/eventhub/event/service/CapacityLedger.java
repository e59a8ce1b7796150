package com.eventhub.event.service;

import com.eventhub.common.exception.CapacityException;
import com.eventhub.event.domain.Booking;
import com.eventhub.event.domain.Event;
import com.eventhub.event.repository.BookingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Enforces booked seats &lt;= capacity per event.
 * <p>
 * Booked totals are always recomputed from the live bookings of the event; nothing is
 * cached. A check-then-write is only indivisible if the caller holds the event's lock
 * from {@link #reserve} until the booking document is written (or deleted, for release).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CapacityLedger {

    private final BookingRepository bookingRepository;

    public int bookedSeats(String eventId) {
        return bookingRepository.findByEventIdOrderByIdAsc(eventId).stream()
                .mapToInt(Booking::getSeatCount)
                .sum();
    }

    public Availability availability(Event event) {
        return new Availability(event.getId(), event.getCapacity(), bookedSeats(event.getId()));
    }

    public Reservation reserve(Event event, int seatCount) {
        return admit(event, seatCount, bookedSeats(event.getId()));
    }

    /**
     * Release-then-reserve for an existing booking: its current seats do not count against
     * the event it is (re)booked on.
     */
    public Reservation reserveReplacing(Event event, Booking booking, int seatCount) {
        int booked = bookedSeats(event.getId());
        if (booking.isFor(event.getId())) {
            booked -= booking.getSeatCount();
        }
        return admit(event, seatCount, booked);
    }

    public void release(Booking booking) {
        bookingRepository.delete(booking);
        log.info("Seats released: bookingId={}, eventId={}, seats={}",
                booking.getId(), booking.getEventId(), booking.getSeatCount());
    }

    private Reservation admit(Event event, int seatCount, int booked) {
        int available = Math.max(event.getCapacity() - booked, 0);
        if (seatCount > available) {
            log.info("Reservation rejected: eventId={}, requested={}, available={}",
                    event.getId(), seatCount, available);
            throw new CapacityException(seatCount, available);
        }
        return new Reservation(event.getId(), seatCount, booked, event.getCapacity());
    }
}
