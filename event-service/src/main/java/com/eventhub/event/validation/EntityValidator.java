package com.eventhub.event.validation;

import com.eventhub.common.exception.FieldViolation;
import com.eventhub.common.exception.ValidationException;
import com.eventhub.event.domain.EntityKind;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.lang.reflect.RecordComponent;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Shape validation of a single payload, independent of other documents.
 * <p>
 * Violations are reported in the payload's declared field order (ties broken by reason),
 * so the first reported violation is stable across runs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntityValidator {

    private final Validator validator;

    public <T extends Record> T validate(EntityKind kind, T payload) {
        if (payload == null) {
            throw new ValidationException("body", "is required");
        }

        Set<ConstraintViolation<T>> violations = validator.validate(payload);
        if (violations.isEmpty()) {
            return payload;
        }

        List<String> fieldOrder = Arrays.stream(payload.getClass().getRecordComponents())
                .map(RecordComponent::getName)
                .toList();

        List<FieldViolation> ordered = violations.stream()
                .map(v -> new FieldViolation(v.getPropertyPath().toString(), v.getMessage()))
                .sorted(Comparator.comparingInt((FieldViolation v) -> position(fieldOrder, v.field()))
                        .thenComparing(FieldViolation::reason))
                .toList();

        log.debug("Rejected {} payload: {}", kind.getLabel(), ordered);
        throw new ValidationException(ordered);
    }

    private static int position(List<String> fieldOrder, String field) {
        int index = fieldOrder.indexOf(field);
        return index >= 0 ? index : fieldOrder.size();
    }
}
