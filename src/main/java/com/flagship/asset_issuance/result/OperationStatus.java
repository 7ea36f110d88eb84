package com.flagship.asset_issuance.result;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tag carried by every public operation result.
 */
public enum OperationStatus {
    SUCCESS("success"),
    ERROR("error");

    private final String value;

    OperationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
