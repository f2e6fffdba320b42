package com.trustgate.common.denial;

import com.trustgate.common.model.DenialEvent;

/** Receives every denial, for audit, reporting and human-visible notices. */
@FunctionalInterface
public interface DenialHook {

    DenialHook NOOP = event -> {};

    void onDenial(DenialEvent event);
}
