package com.trustgate.steering.service;

import com.trustgate.common.identity.IdentityProvider;
import com.trustgate.common.model.Identity;
import com.trustgate.steering.client.TrustPipelineClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reacts to a drift escalation: recompute the identity upstream, reload it, then clear the
 * denial streak.
 *
 * <p>The drift hook fires on the thread that recorded the third denial, so recovery runs
 * asynchronously and returns immediately. At most one recovery is in flight; escalations that
 * arrive meanwhile are dropped. On failure the stale identity stays in effect.
 */
@Service
public class DriftRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(DriftRecoveryService.class);

    private final TrustPipelineClient pipelineClient;
    private final IdentityProvider identityProvider;
    private final Duration recomputeTimeout;
    private final AtomicBoolean inFlight = new AtomicBoolean();

    private volatile Runnable onRecovered = () -> {};

    public DriftRecoveryService(TrustPipelineClient pipelineClient,
                                IdentityProvider identityProvider,
                                @Value("${trust.recompute-timeout-ms:120000}") long recomputeTimeoutMs) {
        this.pipelineClient   = pipelineClient;
        this.identityProvider = identityProvider;
        this.recomputeTimeout = Duration.ofMillis(recomputeTimeoutMs);
    }

    /** Runs after every successful reload. */
    public void onRecovered(Runnable callback) {
        this.onRecovered = callback != null ? callback : () -> {};
    }

    public void trigger() {
        if (!inFlight.compareAndSet(false, true)) {
            log.info("[DriftRecovery] RECOVERY_ALREADY_RUNNING, escalation dropped");
            return;
        }
        recover()
            .doFinally(signal -> inFlight.set(false))
            .subscribe(
                identity -> log.info("[DriftRecovery] RECOVERED sovereignty={}",
                    String.format("%.3f", identity.sovereignty())),
                err -> log.warn("[DriftRecovery] RECOVERY_FAILED, stale identity stays in effect. reason={}",
                    err.getMessage())
            );
    }

    Mono<Identity> recover() {
        log.warn("[DriftRecovery] RECOMPUTE_REQUESTED timeoutMs={}", recomputeTimeout.toMillis());
        return pipelineClient.requestRecompute("drift escalation")
            .timeout(recomputeTimeout)
            .then(Mono.fromCallable(identityProvider::reload).subscribeOn(Schedulers.boundedElastic()))
            .doOnNext(identity -> onRecovered.run());
    }

    public boolean inFlight() {
        return inFlight.get();
    }
}
