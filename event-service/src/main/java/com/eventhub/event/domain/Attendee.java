package com.eventhub.event.domain;

import com.eventhub.common.domain.BaseDocument;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "attendees")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Attendee extends BaseDocument {

    @Id
    private String id;

    private String name;

    private String email;

    private String phone;

    @Builder
    private Attendee(String name, String email, String phone) {
        this.name = name;
        this.email = email;
        this.phone = phone;
    }

    public void update(String name, String email, String phone) {
        if (name != null) {
            this.name = name;
        }
        if (email != null) {
            this.email = email;
        }
        if (phone != null) {
            this.phone = phone;
        }
    }
}
