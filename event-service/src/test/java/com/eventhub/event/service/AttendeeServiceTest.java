package com.eventhub.event.service;

import com.eventhub.common.exception.BusinessException;
import com.eventhub.common.exception.ConflictException;
import com.eventhub.common.exception.ValidationException;
import com.eventhub.common.response.ErrorCode;
import com.eventhub.event.InMemoryDocumentStore;
import com.eventhub.event.LocalLocks;
import com.eventhub.event.config.LockProperties;
import com.eventhub.event.dto.request.CreateAttendeeRequest;
import com.eventhub.event.dto.request.UpdateAttendeeRequest;
import com.eventhub.event.dto.response.AttendeeResponse;
import com.eventhub.event.integrity.ReferentialIntegrityService;
import com.eventhub.event.validation.EntityValidator;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.eventhub.event.TestFixtures.booking;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttendeeServiceTest {

    private InMemoryDocumentStore store;
    private AttendeeService attendeeService;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        attendeeService = new AttendeeService(
                store.attendeeRepository(),
                new EntityValidator(Validation.buildDefaultValidatorFactory().getValidator()),
                new ReferentialIntegrityService(store.venueRepository(), store.eventRepository(),
                        store.attendeeRepository(), store.bookingRepository()),
                new EntityLockService(new LocalLocks().redissonClient(), new LockProperties()));
    }

    @Test
    void registerAttendee_valid_saves() {
        AttendeeResponse response = attendeeService.registerAttendee(
                new CreateAttendeeRequest("Ada", "ada@example.com", "+44 20 7946 0000"));

        assertThat(attendeeService.getAttendee(response.id()).email()).isEqualTo("ada@example.com");
    }

    @Test
    void registerAttendee_badEmail_rejected() {
        assertThatThrownBy(() -> attendeeService.registerAttendee(new CreateAttendeeRequest("Ada", "ada@", null)))
                .isInstanceOf(ValidationException.class)
                .hasFieldOrPropertyWithValue("field", "email");

        assertThat(attendeeService.getAttendees()).isEmpty();
    }

    @Test
    void updateAttendee_partial_keepsOtherFields() {
        AttendeeResponse attendee = attendeeService.registerAttendee(
                new CreateAttendeeRequest("Ada", "ada@example.com", null));

        AttendeeResponse updated = attendeeService.updateAttendee(attendee.id(),
                new UpdateAttendeeRequest(null, null, "555-0100"));

        assertThat(updated.name()).isEqualTo("Ada");
        assertThat(updated.phone()).isEqualTo("555-0100");
    }

    @Test
    void updateAttendee_missing_throwsNotFound() {
        assertThatThrownBy(() -> attendeeService.updateAttendee("missing",
                new UpdateAttendeeRequest("Ada", null, null)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.ATTENDEE_NOT_FOUND);
    }

    @Test
    void deleteAttendee_withBookings_conflict() {
        AttendeeResponse attendee = attendeeService.registerAttendee(
                new CreateAttendeeRequest("Ada", "ada@example.com", null));
        store.bookingRepository().save(booking(null, "e1", attendee.id(), 1));

        assertThatThrownBy(() -> attendeeService.deleteAttendee(attendee.id()))
                .isInstanceOf(ConflictException.class);

        assertThat(attendeeService.getAttendees()).hasSize(1);
    }

    @Test
    void deleteAttendee_withoutBookings_removes() {
        AttendeeResponse attendee = attendeeService.registerAttendee(
                new CreateAttendeeRequest("Ada", "ada@example.com", null));

        attendeeService.deleteAttendee(attendee.id());

        assertThat(attendeeService.getAttendees()).isEmpty();
    }
}
