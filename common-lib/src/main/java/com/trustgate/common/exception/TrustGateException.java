package com.trustgate.common.exception;

/**
 * Base unchecked exception for the trust gate. Carries the name of the component that
 * raised it so log lines and error bodies read {@code [Component] message}.
 */
public class TrustGateException extends RuntimeException {
    private final String component;

    public TrustGateException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public TrustGateException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
