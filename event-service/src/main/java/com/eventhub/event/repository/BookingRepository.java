package com.eventhub.event.repository;

import com.eventhub.event.domain.Booking;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface BookingRepository extends MongoRepository<Booking, String> {

    List<Booking> findByEventIdOrderByIdAsc(String eventId);

    List<Booking> findByAttendeeIdOrderByIdAsc(String attendeeId);
}
