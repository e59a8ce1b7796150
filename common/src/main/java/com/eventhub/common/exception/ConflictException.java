package com.eventhub.common.exception;

import com.eventhub.common.response.ErrorCode;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Delete rejected because live dependents still reference the target.
 */
@Getter
public class ConflictException extends BusinessException {

    private final String dependentKind;
    private final List<String> dependentIds;

    public ConflictException(String dependentKind, List<String> dependentIds) {
        super(ErrorCode.DELETE_RESTRICTED,
                "Still referenced by " + dependentIds.size() + " " + dependentKind + ": " + dependentIds);
        this.dependentKind = dependentKind;
        this.dependentIds = List.copyOf(dependentIds);
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("dependentKind", dependentKind);
        details.put("dependentIds", dependentIds);
        return details;
    }
}
