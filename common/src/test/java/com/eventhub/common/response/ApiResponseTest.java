package com.eventhub.common.response;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ApiResponseTest {

    @Test
    void ok_withData() {
        ApiResponse<String> response = ApiResponse.ok("hello");

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getData()).isEqualTo("hello");
        assertThat(response.getError()).isNull();
    }

    @Test
    void ok_withoutData() {
        ApiResponse<Void> response = ApiResponse.ok();

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getData()).isNull();
    }

    @Test
    void error_withErrorCode() {
        ApiResponse<Void> response = ApiResponse.error(ErrorCode.BOOKING_NOT_FOUND);

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getError().getCode()).isEqualTo("B001");
        assertThat(response.getError().getMessage()).isEqualTo("Booking not found");
        assertThat(response.getError().getDetails()).isEmpty();
    }

    @Test
    void error_withDetails() {
        ApiResponse<Void> response = ApiResponse.error(ErrorCode.CAPACITY_EXCEEDED,
                "Requested 5 seats, only 4 available", Map.of("available", 4));

        assertThat(response.getError().getMessage()).isEqualTo("Requested 5 seats, only 4 available");
        assertThat(response.getError().getDetails()).containsEntry("available", 4);
    }
}
