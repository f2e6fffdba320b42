package com.trustgate.common.permission;

import com.trustgate.common.model.ActionRequirement;
import com.trustgate.common.model.DenialEvent;
import com.trustgate.common.model.Identity;
import com.trustgate.common.model.TrustCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Geometric permission test over the identity vector.
 *
 * <pre>
 *   Permission(identity, action) = overlap(identity, requirement) &gt;= threshold
 *                                  AND identity.sovereignty &gt;= requirement.minSovereignty
 * </pre>
 *
 * <p>Overlap is binary per axis and proportional across the requirement: the fraction of
 * required categories whose identity score meets the category minimum.
 *
 * <p>Actions without a requirement entry are <strong>allowed</strong>. This fail-open default
 * is deliberate and logged once per action name at WARN so unregistered actions surface in
 * operations.
 *
 * <p>Stateless apart from the warn-once set; thread-safe.
 */
public final class PermissionEngine {

    private static final Logger log = LoggerFactory.getLogger(PermissionEngine.class);

    /** Default overlap threshold. */
    public static final double DEFAULT_THRESHOLD = 0.8;

    private final RequirementTable requirements;
    private final double threshold;
    private final Clock clock;
    private final Set<String> warnedUnregistered = ConcurrentHashMap.newKeySet();

    public PermissionEngine(RequirementTable requirements) {
        this(requirements, DEFAULT_THRESHOLD, Clock.systemUTC());
    }

    public PermissionEngine(RequirementTable requirements, double threshold, Clock clock) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in [0.0, 1.0] but was " + threshold);
        }
        this.requirements = requirements;
        this.threshold    = threshold;
        this.clock        = clock;
    }

    // ── Pure geometry ─────────────────────────────────────────────────────

    /**
     * Fraction of {@code requirement.requiredScores} entries met by {@code identity}.
     * Returns 1.0 when the requirement names no categories.
     */
    public static double overlap(Identity identity, ActionRequirement requirement) {
        Map<TrustCategory, Double> required = requirement.requiredScores();
        if (required.isEmpty()) return 1.0;

        long met = required.entrySet().stream()
            .filter(e -> identity.score(e.getKey()) >= e.getValue())
            .count();
        return (double) met / required.size();
    }

    /** Categories whose identity score is below the requirement's minimum. */
    public static List<TrustCategory> failedCategories(Identity identity, ActionRequirement requirement) {
        List<TrustCategory> failed = new ArrayList<>();
        requirement.requiredScores().forEach((category, min) -> {
            if (identity.score(category) < min) failed.add(category);
        });
        return failed;
    }

    public boolean decide(Identity identity, ActionRequirement requirement) {
        return overlap(identity, requirement) >= threshold
            && identity.sovereignty() >= requirement.minSovereignty();
    }

    // ── Table lookup ──────────────────────────────────────────────────────

    public PermissionDecision check(String action, Identity identity) {
        return check(action, action, identity);
    }

    /**
     * Evaluates {@code action} for {@code identity}. {@code skill} is carried into the
     * {@link DenialEvent} so the denial hook knows who asked.
     */
    public PermissionDecision check(String action, String skill, Identity identity) {
        Optional<ActionRequirement> found = requirements.find(action);
        if (found.isEmpty()) {
            if (warnedUnregistered.add(action)) {
                log.warn("[PermissionEngine] UNREGISTERED_ACTION_ALLOWED action={} skill={} (fail-open)", action, skill);
            }
            return PermissionDecision.unregistered(action, identity.sovereignty(), threshold);
        }

        ActionRequirement requirement = found.get();
        double overlap = overlap(identity, requirement);
        List<TrustCategory> failed = failedCategories(identity, requirement);
        boolean allowed = overlap >= threshold && identity.sovereignty() >= requirement.minSovereignty();

        DenialEvent denial = allowed ? null : new DenialEvent(
            action, skill, overlap, identity.sovereignty(), threshold,
            requirement.minSovereignty(), failed, clock.instant());

        log.debug("[PermissionEngine] action={} allowed={} overlap={} sovereignty={} failed={}",
            action, allowed, overlap, identity.sovereignty(), failed);

        return new PermissionDecision(action, allowed, true, overlap, identity.sovereignty(),
            threshold, requirement.minSovereignty(), failed, denial);
    }

    public RequirementTable requirements() {
        return requirements;
    }

    public double threshold() {
        return threshold;
    }
}
