package com.eventhub.event.controller;

import com.eventhub.common.response.ApiResponse;
import com.eventhub.event.domain.EntityKind;
import com.eventhub.event.domain.MediaKind;
import com.eventhub.event.dto.request.CreateVenueRequest;
import com.eventhub.event.dto.request.UpdateVenueRequest;
import com.eventhub.event.dto.response.MediaResponse;
import com.eventhub.event.dto.response.VenueResponse;
import com.eventhub.event.service.MediaAttachmentService;
import com.eventhub.event.service.VenueService;
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

@Tag(name = "Venue", description = "Venue management")
@RestController
@RequestMapping("/api/v1/venues")
@RequiredArgsConstructor
public class VenueController {

    private final VenueService venueService;
    private final MediaAttachmentService mediaAttachmentService;

    @Operation(summary = "Create venue")
    @PostMapping
    public ResponseEntity<ApiResponse<VenueResponse>> createVenue(@RequestBody CreateVenueRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(venueService.createVenue(request)));
    }

    @Operation(summary = "List venues", description = "All venues in insertion order")
    @GetMapping
    public ApiResponse<List<VenueResponse>> getVenues() {
        return ApiResponse.ok(venueService.getVenues());
    }

    @Operation(summary = "Get venue")
    @GetMapping("/{id}")
    public ApiResponse<VenueResponse> getVenue(@PathVariable String id) {
        return ApiResponse.ok(venueService.getVenue(id));
    }

    @Operation(summary = "Update venue", description = "Partial update; capacity may not drop below any event at the venue")
    @PatchMapping("/{id}")
    public ApiResponse<VenueResponse> updateVenue(@PathVariable String id,
                                                  @RequestBody UpdateVenueRequest request) {
        return ApiResponse.ok(venueService.updateVenue(id, request));
    }

    @Operation(summary = "Delete venue", description = "Rejected while any event references the venue")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "204", description = "Venue deleted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Venue not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Events still reference the venue")
    })
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteVenue(@PathVariable String id) {
        venueService.deleteVenue(id);
    }

    @Operation(summary = "Upload venue photo", description = "Replaces any previous photo")
    @PostMapping(value = "/{id}/photo", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<MediaResponse>> uploadPhoto(@PathVariable String id,
                                                                  @RequestPart("file") MultipartFile file)
            throws IOException {
        MediaResponse media = mediaAttachmentService.attach(EntityKind.VENUE, id, MediaKind.VENUE_PHOTO,
                file.getBytes(), file.getContentType(), file.getOriginalFilename());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(media));
    }
}
