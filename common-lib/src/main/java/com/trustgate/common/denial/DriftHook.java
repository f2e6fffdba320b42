package com.trustgate.common.denial;

/**
 * Fired once per run of consecutive denials reaching the drift threshold.
 * Expected to trigger recomputation of the trust identity upstream.
 */
@FunctionalInterface
public interface DriftHook {

    DriftHook NOOP = () -> {};

    void onDrift();
}
