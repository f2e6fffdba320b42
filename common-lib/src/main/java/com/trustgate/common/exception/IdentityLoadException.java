package com.trustgate.common.exception;

public class IdentityLoadException extends TrustGateException {

    public IdentityLoadException(String message, Throwable cause) {
        super("IdentityProvider", message, cause);
    }

    public IdentityLoadException(String message) {
        super("IdentityProvider", message);
    }
}
