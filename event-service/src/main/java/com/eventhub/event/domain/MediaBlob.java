package com.eventhub.event.domain;

import com.eventhub.common.domain.BaseDocument;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Uploaded bytes plus their descriptor. The blob id is the media reference stored on the owner.
 */
@Document(collection = "media_blobs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MediaBlob extends BaseDocument {

    @Id
    private String id;

    private EntityKind ownerKind;

    private String ownerId;

    private MediaKind mediaKind;

    private String filename;

    private String contentType;

    private long size;

    private byte[] content;

    @Builder
    private MediaBlob(String ownerId, MediaKind mediaKind, String filename,
                      String contentType, byte[] content) {
        this.ownerKind = mediaKind.getOwnerKind();
        this.ownerId = ownerId;
        this.mediaKind = mediaKind;
        this.filename = filename;
        this.contentType = contentType;
        this.content = content;
        this.size = content.length;
    }
}
