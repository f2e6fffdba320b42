package com.trustgate.steering.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustgate.common.model.Identity;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Identity as exposed over HTTP, keyed by the pipeline's category names. */
public record IdentityView(
    @JsonProperty("scores")      Map<String, Double> scores,
    @JsonProperty("sovereignty") double sovereignty,
    @JsonProperty("loadedAt")    Instant loadedAt,
    @JsonProperty("source")      String source
) {

    public static IdentityView of(Identity identity, String source) {
        Map<String, Double> scores = new LinkedHashMap<>();
        identity.scores().forEach((category, value) -> scores.put(category.key(), value));
        return new IdentityView(scores, identity.sovereignty(), identity.loadedAt(), source);
    }
}
