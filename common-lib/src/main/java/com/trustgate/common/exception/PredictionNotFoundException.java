package com.trustgate.common.exception;

public class PredictionNotFoundException extends TrustGateException {

    public PredictionNotFoundException(String predictionId) {
        super("PredictionScheduler", "No pending prediction with id " + predictionId);
    }
}
