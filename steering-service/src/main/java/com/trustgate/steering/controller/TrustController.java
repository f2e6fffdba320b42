package com.trustgate.steering.controller;

import com.trustgate.common.denial.DenialTracker;
import com.trustgate.common.exception.UnknownSkillException;
import com.trustgate.common.gateway.ActionGateway;
import com.trustgate.common.gateway.GatewayResult;
import com.trustgate.common.gateway.GatewayStatus;
import com.trustgate.common.model.DenialEvent;
import com.trustgate.common.model.DenialStats;
import com.trustgate.common.model.Identity;
import com.trustgate.common.permission.PermissionEngine;
import com.trustgate.common.prediction.PredictionScheduler;
import com.trustgate.steering.api.IdentityView;
import com.trustgate.steering.api.RequirementView;
import com.trustgate.steering.api.TrustStatsResponse;
import com.trustgate.steering.audit.DenialAuditLog;
import com.trustgate.steering.identity.PipelineIdentityProvider;
import com.trustgate.steering.service.DriftRecoveryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/** Read side of the trust gate plus direct skill invocation through the gateway. */
@RestController
@RequestMapping("/api/v1/trust")
public class TrustController {

    private final ActionGateway gateway;
    private final PermissionEngine permissionEngine;
    private final DenialTracker denialTracker;
    private final PipelineIdentityProvider identityProvider;
    private final PredictionScheduler scheduler;
    private final DriftRecoveryService driftRecoveryService;
    private final DenialAuditLog denialAuditLog;

    public TrustController(ActionGateway gateway,
                           PermissionEngine permissionEngine,
                           DenialTracker denialTracker,
                           PipelineIdentityProvider identityProvider,
                           PredictionScheduler scheduler,
                           DriftRecoveryService driftRecoveryService,
                           DenialAuditLog denialAuditLog) {
        this.gateway              = gateway;
        this.permissionEngine     = permissionEngine;
        this.denialTracker        = denialTracker;
        this.identityProvider     = identityProvider;
        this.scheduler            = scheduler;
        this.driftRecoveryService = driftRecoveryService;
        this.denialAuditLog       = denialAuditLog;
    }

    @GetMapping("/stats")
    public ResponseEntity<TrustStatsResponse> stats() {
        DenialStats stats = denialTracker.stats();
        return ResponseEntity.ok(new TrustStatsResponse(
            stats.totalDenials(), stats.consecutiveDenials(), stats.driftEscalations(),
            identityProvider.get().sovereignty(), permissionEngine.threshold(),
            scheduler.pendingCount(), driftRecoveryService.inFlight()));
    }

    @GetMapping("/identity")
    public ResponseEntity<IdentityView> identity() {
        return ResponseEntity.ok(IdentityView.of(identityProvider.get(), identityProvider.source()));
    }

    @PostMapping("/identity/reload")
    public Mono<ResponseEntity<IdentityView>> reload() {
        return Mono.fromCallable(() -> {
                Identity identity = identityProvider.reload();
                denialTracker.reset();
                return IdentityView.of(identity, identityProvider.source());
            })
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/requirements")
    public ResponseEntity<List<RequirementView>> requirements() {
        return ResponseEntity.ok(permissionEngine.requirements().all().stream()
            .map(RequirementView::of)
            .toList());
    }

    @GetMapping("/denials")
    public Mono<ResponseEntity<List<DenialEvent>>> denials(@RequestParam(defaultValue = "20") int limit) {
        return Mono.fromCallable(() -> denialAuditLog.recent(limit))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/skills/{skill}/invoke")
    public Mono<ResponseEntity<GatewayResult>> invoke(
            @PathVariable String skill,
            @RequestBody(required = false) Map<String, Object> payload) {
        return Mono.fromCallable(() -> gateway.invoke(skill, payload))
            .subscribeOn(Schedulers.boundedElastic())
            .map(result -> {
                if (result.status() == GatewayStatus.UNKNOWN_SKILL) {
                    throw new UnknownSkillException(skill);
                }
                HttpStatus status = result.denied() ? HttpStatus.FORBIDDEN : HttpStatus.OK;
                return ResponseEntity.status(status).body(result);
            });
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
