package com.eventhub.event.service;

import com.eventhub.common.exception.CapacityException;
import com.eventhub.event.domain.Booking;
import com.eventhub.event.domain.Event;
import com.eventhub.event.repository.BookingRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.eventhub.event.TestFixtures.booking;
import static com.eventhub.event.TestFixtures.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CapacityLedgerTest {

    @Mock
    private BookingRepository bookingRepository;

    @InjectMocks
    private CapacityLedger capacityLedger;

    @Test
    void bookedSeats_sumsLiveBookings() {
        given(bookingRepository.findByEventIdOrderByIdAsc("e1"))
                .willReturn(List.of(booking("b1", "e1", "a1", 6), booking("b2", "e1", "a2", 3)));

        assertThat(capacityLedger.bookedSeats("e1")).isEqualTo(9);
    }

    @Test
    void reserve_withinCapacity_admits() {
        Event event = event("e1", "v1", 10);
        given(bookingRepository.findByEventIdOrderByIdAsc("e1"))
                .willReturn(List.of(booking("b1", "e1", "a1", 6)));

        Reservation reservation = capacityLedger.reserve(event, 4);

        assertThat(reservation.bookedBefore()).isEqualTo(6);
        assertThat(reservation.remainingAfter()).isZero();
    }

    @Test
    void reserve_beyondCapacity_reportsRemainingSeats() {
        Event event = event("e1", "v1", 10);
        given(bookingRepository.findByEventIdOrderByIdAsc("e1"))
                .willReturn(List.of(booking("b1", "e1", "a1", 6)));

        assertThatThrownBy(() -> capacityLedger.reserve(event, 5))
                .isInstanceOf(CapacityException.class)
                .hasFieldOrPropertyWithValue("requested", 5)
                .hasFieldOrPropertyWithValue("available", 4);
    }

    @Test
    void reserve_overbookedEvent_reportsZeroAvailable() {
        Event event = event("e1", "v1", 4);
        given(bookingRepository.findByEventIdOrderByIdAsc("e1"))
                .willReturn(List.of(booking("b1", "e1", "a1", 6)));

        assertThatThrownBy(() -> capacityLedger.reserve(event, 1))
                .isInstanceOf(CapacityException.class)
                .hasFieldOrPropertyWithValue("available", 0);
    }

    @Test
    void reserveReplacing_sameEvent_doesNotCountOwnSeats() {
        Event event = event("e1", "v1", 10);
        Booking own = booking("b1", "e1", "a1", 6);
        given(bookingRepository.findByEventIdOrderByIdAsc("e1"))
                .willReturn(List.of(own, booking("b2", "e1", "a2", 2)));

        Reservation reservation = capacityLedger.reserveReplacing(event, own, 8);

        assertThat(reservation.bookedBefore()).isEqualTo(2);
        assertThat(reservation.remainingAfter()).isZero();
    }

    @Test
    void reserveReplacing_otherEvent_countsAllSeats() {
        Event target = event("e2", "v1", 10);
        Booking own = booking("b1", "e1", "a1", 6);
        given(bookingRepository.findByEventIdOrderByIdAsc("e2"))
                .willReturn(List.of(booking("b2", "e2", "a2", 5)));

        assertThatThrownBy(() -> capacityLedger.reserveReplacing(target, own, 6))
                .isInstanceOf(CapacityException.class)
                .hasFieldOrPropertyWithValue("available", 5);
    }

    @Test
    void availability_reportsRemaining() {
        given(bookingRepository.findByEventIdOrderByIdAsc("e1"))
                .willReturn(List.of(booking("b1", "e1", "a1", 6)));

        Availability availability = capacityLedger.availability(event("e1", "v1", 10));

        assertThat(availability.bookedSeats()).isEqualTo(6);
        assertThat(availability.remaining()).isEqualTo(4);
    }

    @Test
    void release_deletesBooking() {
        Booking booking = booking("b1", "e1", "a1", 6);

        capacityLedger.release(booking);

        verify(bookingRepository).delete(booking);
    }
}
