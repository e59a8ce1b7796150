package com.eventhub.event.repository;

import com.eventhub.event.domain.Attendee;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface AttendeeRepository extends MongoRepository<Attendee, String> {
}
