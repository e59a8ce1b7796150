package com.eventhub.event;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@OpenAPIDefinition(info = @Info(
        title = "Event Management API",
        description = "Venues, events, attendees and bookings with referential integrity and capacity control",
        version = "1.0.0"
))
@SpringBootApplication(scanBasePackages = "com.eventhub")
public class EventServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(EventServiceApplication.class, args);
    }
}
