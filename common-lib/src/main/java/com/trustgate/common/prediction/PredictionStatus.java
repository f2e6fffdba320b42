package com.trustgate.common.prediction;

public enum PredictionStatus {
    PENDING,
    COMPLETED,
    REDIRECTED,
    ABORTED;

    public boolean terminal() {
        return this != PENDING;
    }
}
