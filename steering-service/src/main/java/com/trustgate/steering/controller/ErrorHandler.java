package com.trustgate.steering.controller;

import com.trustgate.common.exception.IdentityLoadException;
import com.trustgate.common.exception.PredictionNotFoundException;
import com.trustgate.common.exception.TrustGateException;
import com.trustgate.common.exception.UnknownSkillException;
import com.trustgate.steering.service.BlessNotAuthorizedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

    @ExceptionHandler(PredictionNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(PredictionNotFoundException ex) {
        return body("PREDICTION_NOT_FOUND", ex);
    }

    @ExceptionHandler(UnknownSkillException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleUnknownSkill(UnknownSkillException ex) {
        return body("UNKNOWN_SKILL", ex);
    }

    @ExceptionHandler(BlessNotAuthorizedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Map<String, Object> handleBlessNotAuthorized(BlessNotAuthorizedException ex) {
        return body("BLESS_NOT_AUTHORIZED", ex);
    }

    @ExceptionHandler(IdentityLoadException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleIdentityLoad(IdentityLoadException ex) {
        log.error("Identity reload failed; previous identity stays in effect", ex);
        return body("IDENTITY_UNAVAILABLE", ex);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException ex) {
        return Map.of("code", "BAD_REQUEST", "message", String.valueOf(ex.getMessage()));
    }

    @ExceptionHandler(TrustGateException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleTrustGate(TrustGateException ex) {
        log.error("Unhandled trust gate failure. component={}", ex.getComponent(), ex);
        return body("TRUST_GATE_ERROR", ex);
    }

    private static Map<String, Object> body(String code, TrustGateException ex) {
        return Map.of(
            "code", code,
            "component", ex.getComponent(),
            "message", String.valueOf(ex.getMessage())
        );
    }
}
