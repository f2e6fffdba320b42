package com.trustgate.common.prediction;

/**
 * Host-supplied dispatch to the actual action. May be long-running; it is always invoked
 * outside the scheduler's locks. Returning {@code false} or throwing is an execution failure.
 */
@FunctionalInterface
public interface ExecuteCallback {
    boolean execute(String room, String proposedAction);
}
