package com.flagship.asset_issuance.api.exception;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.asset_issuance.result.OperationStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body for requests rejected before they reach the facade.
 */
@Value
@Builder
public class ApiError {

    @JsonProperty("status")
    @Builder.Default
    OperationStatus status = OperationStatus.ERROR;

    @JsonProperty("error")
    String error;

    @JsonProperty("message")
    String message;

    @JsonProperty("details")
    Map<String, String> details;

    @JsonProperty("timestamp")
    Instant timestamp;
}
