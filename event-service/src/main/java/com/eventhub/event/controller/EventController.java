package com.eventhub.event.controller;

import com.eventhub.common.response.ApiResponse;
import com.eventhub.event.domain.EntityKind;
import com.eventhub.event.domain.MediaKind;
import com.eventhub.event.dto.request.CreateEventRequest;
import com.eventhub.event.dto.request.UpdateEventRequest;
import com.eventhub.event.dto.response.AvailabilityResponse;
import com.eventhub.event.dto.response.EventResponse;
import com.eventhub.event.dto.response.MediaResponse;
import com.eventhub.event.service.EventService;
import com.eventhub.event.service.MediaAttachmentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

@Tag(name = "Event", description = "Event management, availability and promotional media")
@RestController
@RequestMapping("/api/v1/events")
@RequiredArgsConstructor
public class EventController {

    private final EventService eventService;
    private final MediaAttachmentService mediaAttachmentService;

    @Operation(summary = "Create event", description = "Venue must exist and hold the event's capacity")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Event created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Venue does not exist")
    })
    @PostMapping
    public ResponseEntity<ApiResponse<EventResponse>> createEvent(@RequestBody CreateEventRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(eventService.createEvent(request)));
    }

    @Operation(summary = "List events", description = "All events in insertion order")
    @GetMapping
    public ApiResponse<List<EventResponse>> getEvents() {
        return ApiResponse.ok(eventService.getEvents());
    }

    @Operation(summary = "Get event")
    @GetMapping("/{id}")
    public ApiResponse<EventResponse> getEvent(@PathVariable String id) {
        return ApiResponse.ok(eventService.getEvent(id));
    }

    @Operation(summary = "Get availability", description = "Capacity, booked and remaining seats")
    @GetMapping("/{id}/availability")
    public ApiResponse<AvailabilityResponse> getAvailability(@PathVariable String id) {
        return ApiResponse.ok(eventService.getAvailability(id));
    }

    @Operation(summary = "Update event", description = "Partial update; venue and capacity changes are re-verified")
    @PatchMapping("/{id}")
    public ApiResponse<EventResponse> updateEvent(@PathVariable String id,
                                                  @RequestBody UpdateEventRequest request) {
        return ApiResponse.ok(eventService.updateEvent(id, request));
    }

    @Operation(summary = "Delete event", description = "Rejected while any booking references the event")
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteEvent(@PathVariable String id) {
        eventService.deleteEvent(id);
    }

    @Operation(summary = "Upload poster", description = "Replaces any previous poster")
    @PostMapping(value = "/{id}/poster", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<MediaResponse>> uploadPoster(@PathVariable String id,
                                                                   @RequestPart("file") MultipartFile file)
            throws IOException {
        return attach(id, MediaKind.POSTER, file);
    }

    @Operation(summary = "Upload promotional video", description = "Replaces any previous video")
    @PostMapping(value = "/{id}/promo-video", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<MediaResponse>> uploadPromoVideo(@PathVariable String id,
                                                                       @RequestPart("file") MultipartFile file)
            throws IOException {
        return attach(id, MediaKind.PROMO_VIDEO, file);
    }

    private ResponseEntity<ApiResponse<MediaResponse>> attach(String id, MediaKind kind, MultipartFile file)
            throws IOException {
        MediaResponse media = mediaAttachmentService.attach(EntityKind.EVENT, id, kind,
                file.getBytes(), file.getContentType(), file.getOriginalFilename());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(media));
    }
}
