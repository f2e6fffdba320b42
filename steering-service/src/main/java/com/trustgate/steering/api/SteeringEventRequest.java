package com.trustgate.steering.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Inbound message that proposes an action for a room. */
public record SteeringEventRequest(
    @JsonProperty("room")       String room,
    @JsonProperty("contextRef") String contextRef,
    @JsonProperty("author")     String author,
    @JsonProperty("action")     String action
) {}
