package com.trustgate.common.prediction;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustgate.common.model.TrustCategory;

import java.time.Instant;
import java.util.List;

/**
 * A proposed action waiting on its room's countdown or bless.
 *
 * <p>Immutable; every transition yields a new instance via {@link #transition}.
 * {@code generation} is the room generation captured when the prediction was created.
 * {@code timeoutMs} is fixed at creation and is {@code 0} for tiers without a countdown.
 */
public record Prediction(
    @JsonProperty("id")             String id,
    @JsonProperty("room")           String room,
    @JsonProperty("tier")           ExecutionTier tier,
    @JsonProperty("contextRef")     String contextRef,
    @JsonProperty("createdAt")      Instant createdAt,
    @JsonProperty("timeoutMs")      long timeoutMs,
    @JsonProperty("proposedAction") String proposedAction,
    @JsonProperty("categories")     List<TrustCategory> categories,
    @JsonProperty("status")         PredictionStatus status,
    @JsonProperty("generation")     long generation,
    @JsonProperty("reason")         String reason
) {

    public Prediction {
        categories = categories != null ? List.copyOf(categories) : List.of();
    }

    public Prediction transition(PredictionStatus next, String why) {
        return new Prediction(id, room, tier, contextRef, createdAt, timeoutMs,
            proposedAction, categories, next, generation, why);
    }

    /** Proposed action clipped for human-visible notices. */
    public String preview() {
        return proposedAction.length() <= 100 ? proposedAction : proposedAction.substring(0, 100);
    }
}
