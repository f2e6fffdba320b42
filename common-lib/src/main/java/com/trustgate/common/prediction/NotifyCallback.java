package com.trustgate.common.prediction;

/** Surfaces countdowns, redirects and bless outcomes on a human-visible channel. */
@FunctionalInterface
public interface NotifyCallback {

    NotifyCallback NOOP = (contextRef, message) -> {};

    void notify(String contextRef, String message);
}
