package com.eventhub.event.service;

import com.eventhub.event.domain.Attendee;
import com.eventhub.event.domain.EntityKind;
import com.eventhub.event.dto.request.CreateAttendeeRequest;
import com.eventhub.event.dto.request.UpdateAttendeeRequest;
import com.eventhub.event.dto.response.AttendeeResponse;
import com.eventhub.event.integrity.ReferentialIntegrityService;
import com.eventhub.event.repository.AttendeeRepository;
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
public class AttendeeService {

    private final AttendeeRepository attendeeRepository;
    private final EntityValidator entityValidator;
    private final ReferentialIntegrityService integrityService;
    private final EntityLockService entityLockService;

    public AttendeeResponse registerAttendee(CreateAttendeeRequest request) {
        CreateAttendeeRequest valid = entityValidator.validate(EntityKind.ATTENDEE, request.normalized());

        Attendee attendee = attendeeRepository.save(Attendee.builder()
                .name(valid.name())
                .email(valid.email())
                .phone(valid.phone())
                .build());

        log.info("Attendee registered: attendeeId={}", attendee.getId());
        return AttendeeResponse.from(attendee);
    }

    public AttendeeResponse getAttendee(String attendeeId) {
        return AttendeeResponse.from(integrityService.requireAttendee(attendeeId));
    }

    public List<AttendeeResponse> getAttendees() {
        return attendeeRepository.findAll(Sort.by("id")).stream()
                .map(AttendeeResponse::from)
                .toList();
    }

    public AttendeeResponse updateAttendee(String attendeeId, UpdateAttendeeRequest request) {
        UpdateAttendeeRequest valid = entityValidator.validate(EntityKind.ATTENDEE, request.normalized());

        List<RLock> locks = entityLockService.acquireLocks(List.of(EntityKind.ATTENDEE.lockKey(attendeeId)));
        try {
            Attendee attendee = integrityService.requireAttendee(attendeeId);
            attendee.update(valid.name(), valid.email(), valid.phone());
            attendee = attendeeRepository.save(attendee);

            log.info("Attendee updated: attendeeId={}", attendeeId);
            return AttendeeResponse.from(attendee);
        } finally {
            entityLockService.releaseLocks(locks);
        }
    }

    public void deleteAttendee(String attendeeId) {
        List<RLock> locks = entityLockService.acquireLocks(List.of(EntityKind.ATTENDEE.lockKey(attendeeId)));
        try {
            integrityService.requireAttendee(attendeeId);
            integrityService.verifyDelete(EntityKind.ATTENDEE, attendeeId);
            attendeeRepository.deleteById(attendeeId);
            log.info("Attendee deleted: attendeeId={}", attendeeId);
        } finally {
            entityLockService.releaseLocks(locks);
        }
    }
}
