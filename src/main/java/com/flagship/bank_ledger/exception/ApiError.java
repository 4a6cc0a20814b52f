package com.flagship.bank_ledger.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error payload returned by every failing endpoint.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

    @JsonProperty("error")
    String error;

    @JsonProperty("code")
    ErrorCode code;

    @JsonProperty("message")
    String message;

    @JsonProperty("retryable")
    Boolean retryable;

    @JsonProperty("details")
    Map<String, String> details;

    @JsonProperty("correlation_id")
    String correlationId;

    @JsonProperty("timestamp")
    Instant timestamp;
}
