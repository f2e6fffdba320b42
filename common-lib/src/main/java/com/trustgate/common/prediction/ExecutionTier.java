package com.trustgate.common.prediction;

/**
 * How much supervision an inbound event gets.
 *
 * <ul>
 *   <li>{@link #PRIVILEGED}: runs immediately, no countdown (permission is still checked)</li>
 *   <li>{@link #ORDINARY}  : ask-and-predict: a countdown scaled by sovereignty, then runs
 *       unless a human redirects it</li>
 *   <li>{@link #SUGGESTION}: queued without a countdown; runs only when blessed</li>
 * </ul>
 */
public enum ExecutionTier {
    PRIVILEGED,
    ORDINARY,
    SUGGESTION
}
