package com.flagship.impact_ledger.common.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every endpoint.
 * {@code kind} carries the ledger error taxonomy so clients can tell conflicts from bad input.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

    @JsonProperty("error")
    String error;

    @JsonProperty("kind")
    ErrorKind kind;

    @JsonProperty("message")
    String message;

    @JsonProperty("details")
    Map<String, String> details;

    @JsonProperty("timestamp")
    Instant timestamp;
}
