package com.trustgate.steering.service;

import com.trustgate.common.exception.PredictionNotFoundException;
import com.trustgate.common.gateway.ActionGateway;
import com.trustgate.common.gateway.GatewayResult;
import com.trustgate.common.model.TrustCategory;
import com.trustgate.common.prediction.BlessOutcome;
import com.trustgate.common.prediction.ExecutionTier;
import com.trustgate.common.prediction.Prediction;
import com.trustgate.common.prediction.PredictionScheduler;
import com.trustgate.common.prediction.ScheduleOutcome;
import com.trustgate.steering.api.SteeringEventRequest;
import com.trustgate.steering.skill.WorkerSkills;
import com.trustgate.steering.tier.TierClassifier;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Front door for inbound steering events and human signals.
 *
 * <p>Classifies the author, aligns the proposed action with trust categories through the
 * exempt categorizer skill and hands it to the {@link PredictionScheduler}. Execution itself
 * goes back through the gateway's {@value WorkerSkills#AGENT_DISPATCH} skill, so a bless or a
 * privileged event skips the countdown but never the permission check.
 */
@Service
public class SteeringService {

    private static final Logger log = LoggerFactory.getLogger(SteeringService.class);

    private final ActionGateway gateway;
    private final TierClassifier tierClassifier;
    private final PredictionScheduler scheduler;

    public SteeringService(ActionGateway gateway, TierClassifier tierClassifier, PredictionScheduler scheduler) {
        this.gateway        = gateway;
        this.tierClassifier = tierClassifier;
        this.scheduler      = scheduler;
    }

    public ScheduleOutcome submit(SteeringEventRequest event) {
        if (event == null || isBlank(event.room()) || isBlank(event.action())) {
            throw new IllegalArgumentException("room and action are required");
        }
        ExecutionTier tier = tierClassifier.classify(event.author());
        List<TrustCategory> categories = categorize(event.action());
        String contextRef = isBlank(event.contextRef()) ? event.room() : event.contextRef();

        log.info("[SteeringService] EVENT_RECEIVED room={} author={} tier={} categories={}",
            event.room(), event.author(), tier, categories);
        return scheduler.handleEvent(tier, event.room(), contextRef, event.action(), categories);
    }

    public Optional<Prediction> redirect(String room, String reason) {
        return scheduler.redirect(room, isBlank(reason) ? "redirected by human" : reason);
    }

    public BlessOutcome bless(String predictionId, String actor) {
        if (!tierClassifier.canBless(actor)) {
            throw new BlessNotAuthorizedException(actor);
        }
        BlessOutcome outcome = scheduler.bless(predictionId, actor);
        if (!outcome.found()) {
            throw new PredictionNotFoundException(predictionId);
        }
        return outcome;
    }

    public int abortAll() {
        return scheduler.abortAll();
    }

    public List<Prediction> pending() {
        return scheduler.listPending();
    }

    public Optional<Prediction> pending(String room) {
        return scheduler.pending(room);
    }

    @PreDestroy
    public void shutdown() {
        int aborted = scheduler.abortAll();
        log.info("[SteeringService] SHUTDOWN aborted={}", aborted);
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private List<TrustCategory> categorize(String action) {
        GatewayResult result = gateway.invoke(WorkerSkills.CATEGORIZE, Map.of("text", action));
        if (!result.success()) {
            log.warn("[SteeringService] categorize failed: {}", result.result().message());
            return List.of();
        }
        List<TrustCategory> out = new ArrayList<>();
        if (result.result().data().get("categories") instanceof Collection<?> values) {
            for (Object v : values) {
                if (v instanceof TrustCategory c) out.add(c);
            }
        }
        return out;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
