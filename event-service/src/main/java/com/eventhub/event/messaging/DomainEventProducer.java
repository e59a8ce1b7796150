package com.eventhub.event.messaging;

import com.eventhub.common.event.BookingEvent;
import com.eventhub.common.event.DomainEvent;
import com.eventhub.common.event.MediaEvent;
import com.eventhub.event.domain.Booking;
import com.eventhub.event.domain.MediaBlob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes lifecycle events after the corresponding write has committed.
 * A failed publish is logged and never fails the operation that triggered it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DomainEventProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public void publishBookingCreated(Booking booking) {
        BookingEvent event = BookingEvent.created(
                booking.getId(), booking.getEventId(), booking.getAttendeeId(), booking.getSeatCount());
        publish(booking.getEventId(), event);
    }

    public void publishBookingUpdated(Booking booking) {
        BookingEvent event = BookingEvent.updated(
                booking.getId(), booking.getEventId(), booking.getAttendeeId(), booking.getSeatCount());
        publish(booking.getEventId(), event);
    }

    public void publishBookingCancelled(Booking booking) {
        BookingEvent event = BookingEvent.cancelled(
                booking.getId(), booking.getEventId(), booking.getAttendeeId(), booking.getSeatCount());
        publish(booking.getEventId(), event);
    }

    public void publishMediaAttached(MediaBlob blob, String replacedRef) {
        MediaEvent event = MediaEvent.attached(
                blob.getId(), blob.getOwnerKind().name(), blob.getOwnerId(),
                blob.getMediaKind().name(), replacedRef);
        publish(blob.getOwnerId(), event);
    }

    private void publish(String key, DomainEvent event) {
        String topic = event.topic();
        try {
            kafkaTemplate.send(topic, key, event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("Failed to publish {}: topic={}, key={}", event.getEventType(), topic, key, ex);
                        }
                    });
        } catch (RuntimeException e) {
            log.error("Failed to publish {}: topic={}, key={}", event.getEventType(), topic, key, e);
        }
    }
}
