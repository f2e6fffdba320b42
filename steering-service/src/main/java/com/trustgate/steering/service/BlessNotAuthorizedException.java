package com.trustgate.steering.service;

import com.trustgate.common.exception.TrustGateException;

public class BlessNotAuthorizedException extends TrustGateException {

    public BlessNotAuthorizedException(String actor) {
        super("SteeringService", "'" + actor + "' is not allowed to bless predictions");
    }
}
