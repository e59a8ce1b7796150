package com.eventhub.common.exception;

import com.eventhub.common.response.ErrorCode;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public class CapacityException extends BusinessException {

    private final int requested;
    private final int available;

    public CapacityException(int requested, int available) {
        super(ErrorCode.CAPACITY_EXCEEDED,
                "Requested " + requested + " seats, only " + available + " available");
        this.requested = requested;
        this.available = available;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requested", requested);
        details.put("available", available);
        return details;
    }
}
