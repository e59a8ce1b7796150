package com.eventhub.event.domain;

import com.eventhub.common.domain.BaseDocument;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

@Document(collection = "events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Event extends BaseDocument {

    @Id
    private String id;

    private String name;

    private String description;

    private LocalDateTime date;

    @Indexed
    private String venueId;

    private int capacity;

    private String posterRef;

    private String promoVideoRef;

    @Builder
    private Event(String name, String description, LocalDateTime date, String venueId, int capacity) {
        this.name = name;
        this.description = description;
        this.date = date;
        this.venueId = venueId;
        this.capacity = capacity;
    }

    public void update(String name, String description, LocalDateTime date) {
        if (name != null) {
            this.name = name;
        }
        if (description != null) {
            this.description = description;
        }
        if (date != null) {
            this.date = date;
        }
    }

    public void moveTo(String venueId) {
        this.venueId = venueId;
    }

    public void changeCapacity(int capacity) {
        this.capacity = capacity;
    }

    /**
     * Points the given slot at a new blob.
     *
     * @return the reference being replaced, or null if the slot was empty
     */
    public String replaceMedia(MediaKind kind, String mediaRef) {
        String previous;
        switch (kind) {
            case POSTER -> {
                previous = this.posterRef;
                this.posterRef = mediaRef;
            }
            case PROMO_VIDEO -> {
                previous = this.promoVideoRef;
                this.promoVideoRef = mediaRef;
            }
            default -> throw new IllegalArgumentException("Events do not carry " + kind);
        }
        return previous;
    }
}
