package com.eventhub.event.controller;

import com.eventhub.common.response.ApiResponse;
import com.eventhub.event.dto.request.CreateAttendeeRequest;
import com.eventhub.event.dto.request.UpdateAttendeeRequest;
import com.eventhub.event.dto.response.AttendeeResponse;
import com.eventhub.event.service.AttendeeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Attendee", description = "Attendee registration")
@RestController
@RequestMapping("/api/v1/attendees")
@RequiredArgsConstructor
public class AttendeeController {

    private final AttendeeService attendeeService;

    @Operation(summary = "Register attendee")
    @PostMapping
    public ResponseEntity<ApiResponse<AttendeeResponse>> registerAttendee(
            @RequestBody CreateAttendeeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(attendeeService.registerAttendee(request)));
    }

    @Operation(summary = "List attendees")
    @GetMapping
    public ApiResponse<List<AttendeeResponse>> getAttendees() {
        return ApiResponse.ok(attendeeService.getAttendees());
    }

    @Operation(summary = "Get attendee")
    @GetMapping("/{id}")
    public ApiResponse<AttendeeResponse> getAttendee(@PathVariable String id) {
        return ApiResponse.ok(attendeeService.getAttendee(id));
    }

    @Operation(summary = "Update attendee", description = "Partial update")
    @PatchMapping("/{id}")
    public ApiResponse<AttendeeResponse> updateAttendee(@PathVariable String id,
                                                        @RequestBody UpdateAttendeeRequest request) {
        return ApiResponse.ok(attendeeService.updateAttendee(id, request));
    }

    @Operation(summary = "Delete attendee", description = "Rejected while any booking references the attendee")
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteAttendee(@PathVariable String id) {
        attendeeService.deleteAttendee(id);
    }
}
