package com.trustgate.steering.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Asks the external trust pipeline to recompute the identity. The pipeline writes a new
 * {@code run-*} directory; the identity provider picks it up on the next reload.
 */
@Component
public class TrustPipelineClient {

    private static final Logger log = LoggerFactory.getLogger(TrustPipelineClient.class);

    private final WebClient trustPipelineClient;

    public TrustPipelineClient(WebClient trustPipelineClient) {
        this.trustPipelineClient = trustPipelineClient;
    }

    /** Completes once the pipeline reports the run finished; errors propagate to the caller. */
    public Mono<Void> requestRecompute(String reason) {
        return trustPipelineClient.post()
            .uri("/api/v1/pipeline/runs")
            .bodyValue(Map.of("reason", reason))
            .retrieve()
            .toBodilessEntity()
            .doOnNext(r -> log.info("[TrustPipeline] RECOMPUTE_FINISHED status={}", r.getStatusCode()))
            .then();
    }
}
