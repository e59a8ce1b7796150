package com.eventhub.event.service;

import com.eventhub.common.exception.ValidationException;
import com.eventhub.event.domain.EntityKind;
import com.eventhub.event.domain.Event;
import com.eventhub.event.domain.Venue;
import com.eventhub.event.dto.request.CreateVenueRequest;
import com.eventhub.event.dto.request.UpdateVenueRequest;
import com.eventhub.event.dto.response.VenueResponse;
import com.eventhub.event.integrity.ReferentialIntegrityService;
import com.eventhub.event.repository.EventRepository;
import com.eventhub.event.repository.VenueRepository;
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
public class VenueService {

    private final VenueRepository venueRepository;
    private final EventRepository eventRepository;
    private final EntityValidator entityValidator;
    private final ReferentialIntegrityService integrityService;
    private final EntityLockService entityLockService;

    public VenueResponse createVenue(CreateVenueRequest request) {
        CreateVenueRequest valid = entityValidator.validate(EntityKind.VENUE, request.normalized());

        Venue venue = venueRepository.save(Venue.builder()
                .name(valid.name())
                .address(valid.address())
                .capacity(valid.capacity())
                .build());

        log.info("Venue created: venueId={}, capacity={}", venue.getId(), venue.getCapacity());
        return VenueResponse.from(venue);
    }

    public VenueResponse getVenue(String venueId) {
        return VenueResponse.from(integrityService.requireVenue(venueId));
    }

    public List<VenueResponse> getVenues() {
        return venueRepository.findAll(Sort.by("id")).stream()
                .map(VenueResponse::from)
                .toList();
    }

    public VenueResponse updateVenue(String venueId, UpdateVenueRequest request) {
        UpdateVenueRequest valid = entityValidator.validate(EntityKind.VENUE, request.normalized());

        List<RLock> locks = entityLockService.acquireLocks(List.of(EntityKind.VENUE.lockKey(venueId)));
        try {
            Venue venue = integrityService.requireVenue(venueId);

            if (valid.capacity() != null) {
                int largestEvent = eventRepository.findByVenueIdOrderByIdAsc(venueId).stream()
                        .mapToInt(Event::getCapacity)
                        .max()
                        .orElse(0);
                if (valid.capacity() < largestEvent) {
                    throw new ValidationException("capacity",
                            "must be at least " + largestEvent + " to hold the events at this venue");
                }
            }

            venue.update(valid.name(), valid.address(), valid.capacity());
            venue = venueRepository.save(venue);

            log.info("Venue updated: venueId={}", venueId);
            return VenueResponse.from(venue);
        } finally {
            entityLockService.releaseLocks(locks);
        }
    }

    public void deleteVenue(String venueId) {
        List<RLock> locks = entityLockService.acquireLocks(List.of(EntityKind.VENUE.lockKey(venueId)));
        try {
            integrityService.requireVenue(venueId);
            integrityService.verifyDelete(EntityKind.VENUE, venueId);
            venueRepository.deleteById(venueId);
            log.info("Venue deleted: venueId={}", venueId);
        } finally {
            entityLockService.releaseLocks(locks);
        }
    }
}
