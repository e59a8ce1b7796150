package com.eventhub.event.repository;

import com.eventhub.event.domain.Event;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface EventRepository extends MongoRepository<Event, String> {

    List<Event> findByVenueIdOrderByIdAsc(String venueId);
}
