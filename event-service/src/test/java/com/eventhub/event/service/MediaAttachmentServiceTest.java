package com.eventhub.event.service;

import com.eventhub.common.exception.BusinessException;
import com.eventhub.common.exception.ValidationException;
import com.eventhub.common.response.ErrorCode;
import com.eventhub.event.InMemoryDocumentStore;
import com.eventhub.event.LocalLocks;
import com.eventhub.event.config.LockProperties;
import com.eventhub.event.config.MediaProperties;
import com.eventhub.event.domain.EntityKind;
import com.eventhub.event.domain.Event;
import com.eventhub.event.domain.MediaBlob;
import com.eventhub.event.domain.MediaKind;
import com.eventhub.event.domain.Venue;
import com.eventhub.event.dto.response.MediaResponse;
import com.eventhub.event.integrity.ReferentialIntegrityService;
import com.eventhub.event.messaging.DomainEventProducer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.atomic.AtomicBoolean;

import static com.eventhub.event.TestFixtures.event;
import static com.eventhub.event.TestFixtures.venue;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MediaAttachmentServiceTest {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G'};

    @Mock
    private DomainEventProducer domainEventProducer;

    private InMemoryDocumentStore store;
    private LocalLocks locks;
    private MediaProperties mediaProperties;
    private MediaAttachmentService mediaAttachmentService;
    private Event event;
    private Venue venue;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        mediaProperties = new MediaProperties();
        locks = new LocalLocks();
        mediaAttachmentService = new MediaAttachmentService(
                store.mediaBlobRepository(),
                store.eventRepository(),
                store.venueRepository(),
                new ReferentialIntegrityService(store.venueRepository(), store.eventRepository(),
                        store.attendeeRepository(), store.bookingRepository()),
                new EntityLockService(locks.redissonClient(), new LockProperties()),
                mediaProperties,
                domainEventProducer);
        venue = store.venueRepository().save(venue(null, 100));
        event = store.eventRepository().save(event(null, venue.getId(), 50));
    }

    @Test
    void attach_poster_storesBlobAndPointsEventAtIt() {
        MediaResponse media = mediaAttachmentService.attach(EntityKind.EVENT, event.getId(), MediaKind.POSTER,
                PNG, "image/png", "poster.png");

        assertThat(media.size()).isEqualTo(PNG.length);
        assertThat(media.filename()).isEqualTo("poster.png");
        assertThat(store.eventRepository().findById(event.getId()).orElseThrow().getPosterRef())
                .isEqualTo(media.ref());
        verify(domainEventProducer).publishMediaAttached(any(MediaBlob.class), isNull());
    }

    @Test
    void attach_secondPoster_replacesFirst() {
        MediaResponse first = mediaAttachmentService.attach(EntityKind.EVENT, event.getId(), MediaKind.POSTER,
                PNG, "image/png", "first.png");
        MediaResponse second = mediaAttachmentService.attach(EntityKind.EVENT, event.getId(), MediaKind.POSTER,
                PNG, "image/png", "second.png");

        assertThat(store.eventRepository().findById(event.getId()).orElseThrow().getPosterRef())
                .isEqualTo(second.ref());
        verify(domainEventProducer).publishMediaAttached(any(MediaBlob.class), eq(first.ref()));
    }

    @Test
    void attach_promoVideo_leavesPosterUntouched() {
        MediaResponse poster = mediaAttachmentService.attach(EntityKind.EVENT, event.getId(), MediaKind.POSTER,
                PNG, "image/png", "poster.png");
        MediaResponse video = mediaAttachmentService.attach(EntityKind.EVENT, event.getId(), MediaKind.PROMO_VIDEO,
                new byte[]{0, 0, 0, 0x18}, "video/mp4", "promo.mp4");

        Event stored = store.eventRepository().findById(event.getId()).orElseThrow();
        assertThat(stored.getPosterRef()).isEqualTo(poster.ref());
        assertThat(stored.getPromoVideoRef()).isEqualTo(video.ref());
    }

    @Test
    void attach_venuePhoto_pointsVenueAtBlob() {
        MediaResponse media = mediaAttachmentService.attach(EntityKind.VENUE, venue.getId(), MediaKind.VENUE_PHOTO,
                PNG, "image/png; charset=binary", "hall.png");

        assertThat(media.contentType()).isEqualTo("image/png");
        assertThat(store.venueRepository().findById(venue.getId()).orElseThrow().getPhotoRef())
                .isEqualTo(media.ref());
    }

    @Test
    void attach_missingEvent_throwsNotFoundAndStoresNothing() {
        assertThatThrownBy(() -> mediaAttachmentService.attach(EntityKind.EVENT, "missing", MediaKind.POSTER,
                PNG, "image/png", "poster.png"))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.EVENT_NOT_FOUND);

        assertThat(store.mediaBlobs()).isEmpty();
    }

    @Test
    void attach_emptyFile_rejected() {
        assertThatThrownBy(() -> mediaAttachmentService.attach(EntityKind.EVENT, event.getId(), MediaKind.POSTER,
                new byte[0], "image/png", "poster.png"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("file: must not be empty");
    }

    @Test
    void attach_oversizedFile_rejected() {
        mediaProperties.setMaxSizeBytes(3);

        assertThatThrownBy(() -> mediaAttachmentService.attach(EntityKind.EVENT, event.getId(), MediaKind.POSTER,
                PNG, "image/png", "poster.png"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("file: must be at most 3 bytes");
    }

    @Test
    void attach_disallowedType_rejected() {
        assertThatThrownBy(() -> mediaAttachmentService.attach(EntityKind.EVENT, event.getId(), MediaKind.POSTER,
                PNG, "application/pdf", "poster.pdf"))
                .isInstanceOf(ValidationException.class)
                .hasFieldOrPropertyWithValue("field", "contentType");

        verify(domainEventProducer, never()).publishMediaAttached(any(), any());
    }

    @Test
    void attach_mediaKindOfOtherOwner_rejected() {
        assertThatThrownBy(() -> mediaAttachmentService.attach(EntityKind.VENUE, venue.getId(), MediaKind.POSTER,
                PNG, "image/png", "poster.png"))
                .isInstanceOf(ValidationException.class)
                .hasFieldOrPropertyWithValue("field", "mediaKind");
    }

    @Test
    void attach_unsafeFilename_sanitized() {
        MediaResponse media = mediaAttachmentService.attach(EntityKind.EVENT, event.getId(), MediaKind.POSTER,
                PNG, "image/png", "../../etc/<poster>.png");

        assertThat(media.filename()).isEqualTo("poster.png");
    }

    @Test
    void getMedia_missing_throwsNotFound() {
        assertThatThrownBy(() -> mediaAttachmentService.getMedia("missing"))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.MEDIA_NOT_FOUND);
    }

    @Test
    void getDescriptor_returnsStoredMetadata() {
        MediaResponse media = mediaAttachmentService.attach(EntityKind.EVENT, event.getId(), MediaKind.POSTER,
                PNG, "image/png", "poster.png");

        MediaResponse descriptor = mediaAttachmentService.getDescriptor(media.ref());

        assertThat(descriptor.ownerId()).isEqualTo(event.getId());
        assertThat(descriptor.mediaKind()).isEqualTo(MediaKind.POSTER);
    }

    @Test
    void attach_publishesAfterOwnerLockIsReleased() {
        String ownerLock = EntityKind.EVENT.lockKey(event.getId());
        AtomicBoolean heldAtPublish = new AtomicBoolean(true);
        doAnswer(inv -> {
            heldAtPublish.set(locks.isHeldByCurrentThread(ownerLock));
            return null;
        }).when(domainEventProducer).publishMediaAttached(any(MediaBlob.class), isNull());

        mediaAttachmentService.attach(EntityKind.EVENT, event.getId(), MediaKind.POSTER, PNG, "image/png", "p.png");

        assertThat(heldAtPublish).isFalse();
    }
}
