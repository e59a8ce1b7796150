package com.eventhub.common.exception;

import com.eventhub.common.response.ErrorCode;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Malformed, missing or out-of-range field. The first violation is the one reported
 * in the message; all collected violations travel in the details, in field order.
 */
@Getter
public class ValidationException extends BusinessException {

    private final List<FieldViolation> violations;

    public ValidationException(String field, String reason) {
        this(List.of(new FieldViolation(field, reason)));
    }

    public ValidationException(List<FieldViolation> violations) {
        super(ErrorCode.INVALID_INPUT, violations.get(0).toString());
        this.violations = List.copyOf(violations);
    }

    public String getField() {
        return violations.get(0).field();
    }

    public String getReason() {
        return violations.get(0).reason();
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field", getField());
        details.put("reason", getReason());
        details.put("violations", violations.stream().map(FieldViolation::toString).toList());
        return details;
    }
}
