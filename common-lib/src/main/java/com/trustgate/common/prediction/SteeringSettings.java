package com.trustgate.common.prediction;

import java.time.Duration;

/**
 * Scheduler limits.
 *
 * @param maxConcurrentPredictions global cap on PENDING predictions across all rooms
 * @param redirectGrace            window after a redirect in which a second redirect for the
 *                                 same room is ignored
 */
public record SteeringSettings(int maxConcurrentPredictions, Duration redirectGrace) {

    public static final int      DEFAULT_MAX_CONCURRENT = 3;
    public static final Duration DEFAULT_REDIRECT_GRACE = Duration.ofSeconds(5);

    public SteeringSettings {
        if (maxConcurrentPredictions < 1) {
            throw new IllegalArgumentException("maxConcurrentPredictions must be >= 1");
        }
        if (redirectGrace == null || redirectGrace.isNegative()) {
            throw new IllegalArgumentException("redirectGrace must be a non-negative duration");
        }
    }

    public static SteeringSettings defaults() {
        return new SteeringSettings(DEFAULT_MAX_CONCURRENT, DEFAULT_REDIRECT_GRACE);
    }
}
