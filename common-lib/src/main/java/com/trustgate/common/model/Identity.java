package com.trustgate.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Current trust identity: one score per {@link TrustCategory} plus the scalar sovereignty.
 *
 * <p>All values are in [0.0, 1.0]; the constructor rejects anything else.
 * A category missing from {@code scores} reads as {@code 0.0}.
 * Instances are immutable and swapped atomically by an {@code IdentityProvider}.
 */
public record Identity(
    @JsonProperty("scores")      Map<TrustCategory, Double> scores,
    @JsonProperty("sovereignty") double sovereignty,
    @JsonProperty("loadedAt")    Instant loadedAt
) {

    public Identity {
        requireUnit("sovereignty", sovereignty);
        EnumMap<TrustCategory, Double> copy = new EnumMap<>(TrustCategory.class);
        if (scores != null) {
            scores.forEach((category, value) -> {
                if (category == null || value == null) {
                    throw new IllegalArgumentException("Identity scores must not contain null keys or values");
                }
                requireUnit(category.key(), value);
                copy.put(category, value);
            });
        }
        scores = Collections.unmodifiableMap(copy);
        loadedAt = loadedAt != null ? loadedAt : Instant.now();
    }

    public static Identity of(Map<TrustCategory, Double> scores, double sovereignty) {
        return new Identity(scores, sovereignty, Instant.now());
    }

    /** Identity with every category at {@code score} and the given sovereignty. */
    public static Identity uniform(double score, double sovereignty) {
        EnumMap<TrustCategory, Double> all = new EnumMap<>(TrustCategory.class);
        for (TrustCategory c : TrustCategory.values()) {
            all.put(c, score);
        }
        return of(all, sovereignty);
    }

    public double score(TrustCategory category) {
        return scores.getOrDefault(category, 0.0);
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(
                String.format("Identity value %s=%s outside [0.0, 1.0]", name, value));
        }
    }
}
