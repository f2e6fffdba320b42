package com.trustgate.common.prediction;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * <ul>
 *   <li>{@code PENDING}  : {@code prediction} is queued; {@code execution} is {@code null}</li>
 *   <li>{@code COMPLETED}: {@code execution} holds the synchronous result</li>
 *   <li>{@code REJECTED} : both are {@code null}; {@code reason} explains</li>
 * </ul>
 */
public record ScheduleOutcome(
    @JsonProperty("status")     ScheduleStatus status,
    @JsonProperty("prediction") Prediction prediction,
    @JsonProperty("execution")  ExecutionResult execution,
    @JsonProperty("reason")     String reason
) {

    static ScheduleOutcome pending(Prediction prediction) {
        return new ScheduleOutcome(ScheduleStatus.PENDING, prediction, null, null);
    }

    static ScheduleOutcome completed(Prediction prediction, ExecutionResult execution) {
        return new ScheduleOutcome(ScheduleStatus.COMPLETED, prediction, execution, null);
    }

    static ScheduleOutcome rejected(String reason) {
        return new ScheduleOutcome(ScheduleStatus.REJECTED, null, null, reason);
    }
}
