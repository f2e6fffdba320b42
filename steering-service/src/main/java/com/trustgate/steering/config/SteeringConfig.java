package com.trustgate.steering.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trustgate.common.denial.DenialTracker;
import com.trustgate.common.gateway.ActionGateway;
import com.trustgate.common.gateway.GatewayResult;
import com.trustgate.common.gateway.SkillRegistry;
import com.trustgate.common.identity.IdentityProvider;
import com.trustgate.common.model.ActionRequirement;
import com.trustgate.common.permission.PermissionEngine;
import com.trustgate.common.permission.RequirementTable;
import com.trustgate.common.prediction.PredictionScheduler;
import com.trustgate.common.prediction.SovereigntyTimeoutPolicy;
import com.trustgate.common.prediction.SteeringSettings;
import com.trustgate.common.skill.KeywordCategorizer;
import com.trustgate.steering.audit.DenialAuditLog;
import com.trustgate.steering.client.WorkerDispatchClient;
import com.trustgate.steering.notify.ChannelNotifier;
import com.trustgate.steering.service.DriftRecoveryService;
import com.trustgate.steering.skill.WorkerSkills;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

@Configuration
public class SteeringConfig {

    private static final Logger log = LoggerFactory.getLogger(SteeringConfig.class);

    @Value("${services.trust-pipeline.base-url}")
    private String trustPipelineUrl;

    @Value("${services.worker.base-url}")
    private String workerUrl;

    @Value("${trust.threshold:0.8}")
    private double threshold;

    @Value("${trust.drift-threshold:3}")
    private int driftThreshold;

    @Value("${trust.requirements-file:}")
    private String requirementsFile;

    @Value("${steering.max-concurrent-predictions:3}")
    private int maxConcurrentPredictions;

    @Value("${steering.redirect-grace-ms:5000}")
    private long redirectGraceMs;

    @Value("${steering.sovereignty-timeouts:true}")
    private boolean sovereigntyTimeouts;

    @Value("${steering.fixed-timeout-ms:30000}")
    private long fixedTimeoutMs;

    @Value("${steering.dispatch-permission:shell_execute}")
    private String dispatchPermission;

    // ── Infrastructure ────────────────────────────────────────────────────

    @Bean
    public WebClient trustPipelineClient(WebClient.Builder builder) {
        return builder.baseUrl(trustPipelineUrl).build();
    }

    @Bean
    public WebClient workerClient(WebClient.Builder builder) {
        return builder.baseUrl(workerUrl).build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ── Permission path ───────────────────────────────────────────────────

    @Bean
    public RequirementTable requirementTable(ObjectMapper objectMapper) {
        RequirementTable table = RequirementTable.defaults();
        if (requirementsFile == null || requirementsFile.isBlank()) {
            return table;
        }
        List<ActionRequirement> overrides = RequirementOverrides.load(Paths.get(requirementsFile), objectMapper);
        log.info("[SteeringConfig] REQUIREMENT_OVERRIDES file={} count={}", requirementsFile, overrides.size());
        return table.withOverrides(overrides);
    }

    @Bean
    public PermissionEngine permissionEngine(RequirementTable requirementTable, Clock clock) {
        return new PermissionEngine(requirementTable, threshold, clock);
    }

    @Bean
    public KeywordCategorizer keywordCategorizer() {
        return new KeywordCategorizer();
    }

    @Bean
    public SkillRegistry skillRegistry(WorkerDispatchClient workerDispatchClient, KeywordCategorizer keywordCategorizer) {
        return new SkillRegistry(WorkerSkills.build(workerDispatchClient, keywordCategorizer, dispatchPermission));
    }

    @Bean
    public DenialTracker denialTracker(DenialAuditLog denialAuditLog,
                                       ChannelNotifier channelNotifier,
                                       DriftRecoveryService driftRecoveryService) {
        DenialTracker tracker = new DenialTracker(
            event -> {
                denialAuditLog.append(event);
                channelNotifier.denied(event);
            },
            driftRecoveryService::trigger,
            driftThreshold);
        driftRecoveryService.onRecovered(tracker::reset);
        return tracker;
    }

    @Bean
    public ActionGateway actionGateway(SkillRegistry skillRegistry, PermissionEngine permissionEngine,
                                       DenialTracker denialTracker, IdentityProvider identityProvider) {
        return new ActionGateway(skillRegistry, permissionEngine, denialTracker, identityProvider);
    }

    // ── Steering ──────────────────────────────────────────────────────────

    @Bean
    public SteeringSettings steeringSettings() {
        return new SteeringSettings(maxConcurrentPredictions, Duration.ofMillis(redirectGraceMs));
    }

    @Bean
    public SovereigntyTimeoutPolicy sovereigntyTimeoutPolicy(IdentityProvider identityProvider) {
        return new SovereigntyTimeoutPolicy(identityProvider, sovereigntyTimeouts, Duration.ofMillis(fixedTimeoutMs));
    }

    @Bean
    public PredictionScheduler predictionScheduler(SovereigntyTimeoutPolicy timeoutPolicy,
                                                   SteeringSettings steeringSettings,
                                                   ActionGateway actionGateway,
                                                   ChannelNotifier channelNotifier,
                                                   Clock clock) {
        return new PredictionScheduler(timeoutPolicy, steeringSettings,
            (room, action) -> {
                GatewayResult result = actionGateway.invoke(WorkerSkills.AGENT_DISPATCH,
                    Map.of("room", room, "action", action));
                return result.success();
            },
            channelNotifier,
            Schedulers.boundedElastic(),
            clock);
    }
}
