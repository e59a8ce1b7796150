package com.eventhub.event.domain;

import com.eventhub.common.domain.BaseDocument;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "venues")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Venue extends BaseDocument {

    @Id
    private String id;

    private String name;

    private String address;

    private int capacity;

    private String photoRef;

    @Builder
    private Venue(String name, String address, int capacity) {
        this.name = name;
        this.address = address;
        this.capacity = capacity;
    }

    public void update(String name, String address, Integer capacity) {
        if (name != null) {
            this.name = name;
        }
        if (address != null) {
            this.address = address;
        }
        if (capacity != null) {
            this.capacity = capacity;
        }
    }

    /**
     * @return the reference being replaced, or null if there was none
     */
    public String replacePhoto(String photoRef) {
        String previous = this.photoRef;
        this.photoRef = photoRef;
        return previous;
    }
}
