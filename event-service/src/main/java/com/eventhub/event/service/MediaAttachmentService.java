package com.eventhub.event.service;

import com.eventhub.common.exception.BusinessException;
import com.eventhub.common.exception.ValidationException;
import com.eventhub.common.response.ErrorCode;
import com.eventhub.common.util.Sanitizers;
import com.eventhub.event.config.MediaProperties;
import com.eventhub.event.domain.EntityKind;
import com.eventhub.event.domain.Event;
import com.eventhub.event.domain.MediaBlob;
import com.eventhub.event.domain.MediaKind;
import com.eventhub.event.domain.Venue;
import com.eventhub.event.dto.response.MediaResponse;
import com.eventhub.event.integrity.ReferentialIntegrityService;
import com.eventhub.event.messaging.DomainEventProducer;
import com.eventhub.event.repository.EventRepository;
import com.eventhub.event.repository.MediaBlobRepository;
import com.eventhub.event.repository.VenueRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Attaches uploaded media to an event or venue. The blob is stored first, then the owner's
 * slot is pointed at it under the owner's lock; the previously referenced blob is left
 * in place, unreferenced.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MediaAttachmentService {

    private final MediaBlobRepository mediaBlobRepository;
    private final EventRepository eventRepository;
    private final VenueRepository venueRepository;
    private final ReferentialIntegrityService integrityService;
    private final EntityLockService entityLockService;
    private final MediaProperties mediaProperties;
    private final DomainEventProducer domainEventProducer;

    public MediaResponse attach(EntityKind ownerKind, String ownerId, MediaKind mediaKind,
                                byte[] content, String contentType, String filename) {
        if (mediaKind.getOwnerKind() != ownerKind) {
            throw new ValidationException("mediaKind",
                    mediaKind + " cannot be attached to a " + ownerKind.getLabel());
        }
        String normalizedType = checkContent(mediaKind, content, contentType);

        MediaBlob blob;
        String replacedRef;
        List<RLock> locks = entityLockService.acquireLocks(List.of(ownerKind.lockKey(ownerId)));
        try {
            if (ownerKind == EntityKind.EVENT) {
                Event event = integrityService.requireEvent(ownerId);
                blob = storeBlob(ownerId, mediaKind, content, normalizedType, filename);
                replacedRef = event.replaceMedia(mediaKind, blob.getId());
                eventRepository.save(event);
            } else {
                Venue venue = integrityService.requireVenue(ownerId);
                blob = storeBlob(ownerId, mediaKind, content, normalizedType, filename);
                replacedRef = venue.replacePhoto(blob.getId());
                venueRepository.save(venue);
            }

            log.info("Media attached: ref={}, owner={}:{}, kind={}, size={}, replaced={}",
                    blob.getId(), ownerKind.getLabel(), ownerId, mediaKind, blob.getSize(), replacedRef);
        } finally {
            entityLockService.releaseLocks(locks);
        }

        domainEventProducer.publishMediaAttached(blob, replacedRef);
        return MediaResponse.from(blob);
    }

    public MediaBlob getMedia(String mediaRef) {
        return mediaBlobRepository.findById(mediaRef)
                .orElseThrow(() -> new BusinessException(ErrorCode.MEDIA_NOT_FOUND,
                        "Media not found: " + mediaRef));
    }

    public MediaResponse getDescriptor(String mediaRef) {
        return MediaResponse.from(getMedia(mediaRef));
    }

    private MediaBlob storeBlob(String ownerId, MediaKind mediaKind, byte[] content,
                                String contentType, String filename) {
        return mediaBlobRepository.save(MediaBlob.builder()
                .ownerId(ownerId)
                .mediaKind(mediaKind)
                .filename(Sanitizers.filename(filename))
                .contentType(contentType)
                .content(content)
                .build());
    }

    private String checkContent(MediaKind mediaKind, byte[] content, String contentType) {
        if (content == null || content.length == 0) {
            throw new ValidationException("file", "must not be empty");
        }
        if (content.length > mediaProperties.getMaxSizeBytes()) {
            throw new ValidationException("file",
                    "must be at most " + mediaProperties.getMaxSizeBytes() + " bytes");
        }

        String normalizedType = normalizeContentType(contentType);
        List<String> allowed = mediaProperties.allowedTypes(mediaKind);
        if (normalizedType == null || !allowed.contains(normalizedType)) {
            throw new ValidationException("contentType", "must be one of " + allowed);
        }
        return normalizedType;
    }

    private static String normalizeContentType(String contentType) {
        if (contentType == null) {
            return null;
        }
        int paramStart = contentType.indexOf(';');
        String mediaType = paramStart >= 0 ? contentType.substring(0, paramStart) : contentType;
        return mediaType.strip().toLowerCase(Locale.ROOT);
    }
}
