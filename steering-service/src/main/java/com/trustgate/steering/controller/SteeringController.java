package com.trustgate.steering.controller;

import com.trustgate.common.prediction.BlessOutcome;
import com.trustgate.common.prediction.Prediction;
import com.trustgate.common.prediction.ScheduleOutcome;
import com.trustgate.common.trace.TraceContextUtil;
import com.trustgate.steering.api.AbortResponse;
import com.trustgate.steering.api.BlessRequest;
import com.trustgate.steering.api.RedirectRequest;
import com.trustgate.steering.api.SteeringEventRequest;
import com.trustgate.steering.service.SteeringService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.UUID;

/**
 * Inbound events and human signals. Privileged events and blesses run the execute callback
 * synchronously, so every mutating call is moved off the event loop.
 *
 * <p>Mutating calls carry a trace id: the {@code X-Trace-Id} request header, or a fresh UUID.
 * It is logged with the outcome and echoed on the response.
 */
@RestController
@RequestMapping("/api/v1/steering")
public class SteeringController {

    private static final Logger log = LoggerFactory.getLogger(SteeringController.class);

    static final String TRACE_HEADER = "X-Trace-Id";

    private final SteeringService steeringService;

    public SteeringController(SteeringService steeringService) {
        this.steeringService = steeringService;
    }

    @PostMapping("/events")
    public Mono<ResponseEntity<ScheduleOutcome>> submit(
            @RequestBody SteeringEventRequest event,
            @RequestHeader(value = TRACE_HEADER, required = false) String traceId) {
        return traced("EVENT_HANDLED", Mono.fromCallable(() -> steeringService.submit(event))
            .subscribeOn(Schedulers.boundedElastic())
            .map(outcome -> ResponseEntity.status(statusFor(outcome)).body(outcome)), traceId);
    }

    @PostMapping("/rooms/{room}/redirect")
    public Mono<ResponseEntity<Prediction>> redirect(
            @PathVariable String room,
            @RequestBody(required = false) RedirectRequest request,
            @RequestHeader(value = TRACE_HEADER, required = false) String traceId) {
        String reason = request != null ? request.reason() : null;
        return traced("REDIRECT_HANDLED", Mono.fromCallable(() -> steeringService.redirect(room, reason))
            .subscribeOn(Schedulers.boundedElastic())
            .map(redirected -> redirected
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build())), traceId);
    }

    @PostMapping("/predictions/{id}/bless")
    public Mono<ResponseEntity<BlessOutcome>> bless(
            @PathVariable String id,
            @RequestBody BlessRequest request,
            @RequestHeader(value = TRACE_HEADER, required = false) String traceId) {
        return traced("BLESS_HANDLED", Mono.fromCallable(() -> steeringService.bless(id, request.actor()))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok), traceId);
    }

    @PostMapping("/abort")
    public Mono<ResponseEntity<AbortResponse>> abort(
            @RequestHeader(value = TRACE_HEADER, required = false) String traceId) {
        return traced("ABORT_HANDLED", Mono.fromCallable(() -> new AbortResponse(steeringService.abortAll()))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok), traceId);
    }

    @GetMapping("/predictions")
    public ResponseEntity<List<Prediction>> pending() {
        return ResponseEntity.ok(steeringService.pending());
    }

    @GetMapping("/rooms/{room}/pending")
    public ResponseEntity<Prediction> pending(@PathVariable String room) {
        return steeringService.pending(room)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static HttpStatus statusFor(ScheduleOutcome outcome) {
        return switch (outcome.status()) {
            case PENDING   -> HttpStatus.ACCEPTED;
            case COMPLETED -> HttpStatus.OK;
            case REJECTED  -> HttpStatus.TOO_MANY_REQUESTS;
        };
    }

    private static <T> Mono<ResponseEntity<T>> traced(String operation, Mono<ResponseEntity<T>> response,
                                                      String traceId) {
        Mono<ResponseEntity<T>> logged = response
            .doOnEach(TraceContextUtil.onNextWithMdc((entity, id) ->
                log.info("[SteeringController] {} status={} traceId={}",
                    operation, entity.getStatusCode().value(), id)))
            .flatMap(entity -> Mono.deferContextual(ctx ->
                Mono.just(withTraceHeader(entity, TraceContextUtil.getTraceId(ctx)))));
        String resolved = traceId != null && !traceId.isBlank() ? traceId : UUID.randomUUID().toString();
        return TraceContextUtil.withTraceId(logged, resolved);
    }

    private static <T> ResponseEntity<T> withTraceHeader(ResponseEntity<T> entity, String traceId) {
        return ResponseEntity.status(entity.getStatusCode())
            .headers(entity.getHeaders())
            .header(TRACE_HEADER, traceId)
            .body(entity.getBody());
    }
}
