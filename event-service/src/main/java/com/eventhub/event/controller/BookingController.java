package com.eventhub.event.controller;

import com.eventhub.common.response.ApiResponse;
import com.eventhub.event.dto.request.CreateBookingRequest;
import com.eventhub.event.dto.request.UpdateBookingRequest;
import com.eventhub.event.dto.response.BookingResponse;
import com.eventhub.event.service.BookingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Booking", description = "Capacity-controlled seat booking")
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingService bookingService;

    @Operation(summary = "Create booking", description = "Admitted only if event and attendee exist and seats remain")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Booking created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Event or attendee does not exist"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Not enough capacity left"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Service temporarily unavailable")
    })
    @PostMapping
    public ResponseEntity<ApiResponse<BookingResponse>> createBooking(@RequestBody CreateBookingRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(bookingService.createBooking(request)));
    }

    @Operation(summary = "List bookings")
    @GetMapping
    public ApiResponse<List<BookingResponse>> getBookings() {
        return ApiResponse.ok(bookingService.getBookings());
    }

    @Operation(summary = "Get booking")
    @GetMapping("/{id}")
    public ApiResponse<BookingResponse> getBooking(@PathVariable String id) {
        return ApiResponse.ok(bookingService.getBooking(id));
    }

    @Operation(summary = "Update booking", description = "Partial update; seat count or event changes are re-checked against capacity")
    @PatchMapping("/{id}")
    public ApiResponse<BookingResponse> updateBooking(@PathVariable String id,
                                                      @RequestBody UpdateBookingRequest request) {
        return ApiResponse.ok(bookingService.updateBooking(id, request));
    }

    @Operation(summary = "Cancel booking", description = "Deletes the booking and releases its seats")
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteBooking(@PathVariable String id) {
        bookingService.deleteBooking(id);
    }
}
