package com.eventhub.common.event;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Topics {

    // Booking
    public static final String BOOKING_CREATED = "eventhub.booking.created";
    public static final String BOOKING_UPDATED = "eventhub.booking.updated";
    public static final String BOOKING_CANCELLED = "eventhub.booking.cancelled";

    // Media
    public static final String MEDIA_ATTACHED = "eventhub.media.attached";

    // Partition counts per topic category
    public static final int PARTITIONS_BOOKING = 6;
    public static final int PARTITIONS_MEDIA = 2;
}
