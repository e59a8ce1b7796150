package com.eventhub.common.exception;

public record FieldViolation(String field, String reason) {

    @Override
    public String toString() {
        return field + ": " + reason;
    }
}
