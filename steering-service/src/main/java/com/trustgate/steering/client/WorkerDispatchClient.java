package com.trustgate.steering.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.trustgate.common.skill.SkillResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Runs a permitted skill on the worker that owns its side effects (shell, mail, files).
 *
 * <p>Called from the gateway after the permission check passed, always on a bounded-elastic
 * thread, so blocking here is acceptable. Transport failures become a failed {@link SkillResult};
 * the gateway never retries.
 */
@Component
public class WorkerDispatchClient {

    private static final Logger log = LoggerFactory.getLogger(WorkerDispatchClient.class);

    private final WebClient workerClient;
    private final Duration timeout;

    public WorkerDispatchClient(WebClient workerClient,
                                @Value("${services.worker.timeout-ms:60000}") long timeoutMs) {
        this.workerClient = workerClient;
        this.timeout      = Duration.ofMillis(timeoutMs);
    }

    public SkillResult dispatch(String skill, Map<String, Object> payload) {
        try {
            JsonNode body = workerClient.post()
                .uri("/api/v1/skills/{skill}", skill)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(timeout);

            boolean success = body == null || body.path("success").asBoolean(true);
            String message  = body != null ? body.path("message").asText("dispatched") : "dispatched";
            log.info("[WorkerDispatch] DISPATCHED skill={} success={}", skill, success);
            return success ? SkillResult.ok(message) : SkillResult.failure(message);
        } catch (RuntimeException e) {
            log.warn("[WorkerDispatch] DISPATCH_FAILED skill={} reason={}", skill, e.getMessage());
            return SkillResult.failure("Worker dispatch failed for " + skill + ": " + e.getMessage());
        }
    }
}
