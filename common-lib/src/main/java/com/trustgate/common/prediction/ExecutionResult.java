package com.trustgate.common.prediction;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Outcome of one execute-callback attempt. {@code error} is {@code null} on success. */
public record ExecutionResult(
    @JsonProperty("success") boolean success,
    @JsonProperty("error")   String error
) {

    public static ExecutionResult succeeded() {
        return new ExecutionResult(true, null);
    }

    public static ExecutionResult failed(String error) {
        return new ExecutionResult(false, error);
    }
}
