package com.eventhub.event.dto.response;

import com.eventhub.event.domain.EntityKind;
import com.eventhub.event.domain.MediaBlob;
import com.eventhub.event.domain.MediaKind;

import java.time.Instant;

public record MediaResponse(
        String ref,
        EntityKind ownerKind,
        String ownerId,
        MediaKind mediaKind,
        String filename,
        String contentType,
        long size,
        Instant uploadedAt
) {
    public static MediaResponse from(MediaBlob blob) {
        return new MediaResponse(
                blob.getId(),
                blob.getOwnerKind(),
                blob.getOwnerId(),
                blob.getMediaKind(),
                blob.getFilename(),
                blob.getContentType(),
                blob.getSize(),
                blob.getCreatedAt()
        );
    }
}
