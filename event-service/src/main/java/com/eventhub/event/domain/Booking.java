package com.eventhub.event.domain;

import com.eventhub.common.domain.BaseDocument;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * A seat reservation. Cancelling a booking deletes the document, so every stored
 * booking counts against its event's capacity.
 */
@Document(collection = "bookings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Booking extends BaseDocument {

    public static final String DEFAULT_TICKET_TYPE = "GENERAL";

    @Id
    private String id;

    @Indexed
    private String eventId;

    @Indexed
    private String attendeeId;

    private int seatCount;

    private String ticketType;

    @Builder
    private Booking(String eventId, String attendeeId, int seatCount, String ticketType) {
        this.eventId = eventId;
        this.attendeeId = attendeeId;
        this.seatCount = seatCount;
        this.ticketType = ticketType != null ? ticketType : DEFAULT_TICKET_TYPE;
    }

    public boolean isFor(String eventId) {
        return this.eventId.equals(eventId);
    }

    public void moveTo(String eventId) {
        this.eventId = eventId;
    }

    public void transferTo(String attendeeId) {
        this.attendeeId = attendeeId;
    }

    public void resize(int seatCount) {
        this.seatCount = seatCount;
    }

    public void changeTicketType(String ticketType) {
        this.ticketType = ticketType;
    }
}
