package com.eventhub.event.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Attachment slots. Each owner holds at most one attachment per kind.
 */
@Getter
@RequiredArgsConstructor
public enum MediaKind {

    POSTER(EntityKind.EVENT),
    PROMO_VIDEO(EntityKind.EVENT),
    VENUE_PHOTO(EntityKind.VENUE);

    private final EntityKind ownerKind;
}
