package com.eventhub.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MediaEvent extends DomainEvent {

    public static final String TYPE_ATTACHED = "MEDIA_ATTACHED";

    private String mediaRef;
    private String ownerKind;
    private String ownerId;
    private String mediaKind;
    private String replacedRef;

    private MediaEvent(String eventType, String mediaRef, String ownerKind, String ownerId,
                       String mediaKind, String replacedRef) {
        super(eventType);
        this.mediaRef = mediaRef;
        this.ownerKind = ownerKind;
        this.ownerId = ownerId;
        this.mediaKind = mediaKind;
        this.replacedRef = replacedRef;
    }

    @Override
    public String topic() {
        return Topics.MEDIA_ATTACHED;
    }

    public static MediaEvent attached(String mediaRef, String ownerKind, String ownerId,
                                      String mediaKind, String replacedRef) {
        return new MediaEvent(TYPE_ATTACHED, mediaRef, ownerKind, ownerId, mediaKind, replacedRef);
    }
}
