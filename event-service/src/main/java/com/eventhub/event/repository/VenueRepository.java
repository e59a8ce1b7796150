package com.eventhub.event.repository;

import com.eventhub.event.domain.Venue;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface VenueRepository extends MongoRepository<Venue, String> {
}
