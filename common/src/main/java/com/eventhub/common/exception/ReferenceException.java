package com.eventhub.common.exception;

import com.eventhub.common.response.ErrorCode;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A foreign reference in a create or update payload names a document that does not exist.
 */
@Getter
public class ReferenceException extends BusinessException {

    private final String missingField;
    private final String missingId;

    public ReferenceException(String missingField, String missingId) {
        super(ErrorCode.REFERENCE_NOT_FOUND, missingField + " references a nonexistent document: " + missingId);
        this.missingField = missingField;
        this.missingId = missingId;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("missingField", missingField);
        details.put("missingId", missingId);
        return details;
    }
}
