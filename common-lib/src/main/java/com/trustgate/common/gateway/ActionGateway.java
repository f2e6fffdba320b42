package com.trustgate.common.gateway;

import com.trustgate.common.denial.DenialTracker;
import com.trustgate.common.identity.IdentityProvider;
import com.trustgate.common.model.TrustCategory;
import com.trustgate.common.permission.PermissionDecision;
import com.trustgate.common.permission.PermissionEngine;
import com.trustgate.common.skill.CategorizerSkill;
import com.trustgate.common.skill.ExecutableSkill;
import com.trustgate.common.skill.Skill;
import com.trustgate.common.skill.SkillResult;
import com.trustgate.common.skill.TrainerSkill;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Single entry point for every skill invocation.
 *
 * <pre>
 *   resolve skill → exempt? run
 *                 → PermissionEngine.check(permission, identity)
 *                     denied  → DenialTracker.recordDenial → checkDrift → return denial
 *                     allowed → DenialTracker.recordAllow  → run → return result as-is
 * </pre>
 *
 * <p>The gateway never retries: a failed skill result is returned unmodified and retry policy
 * belongs to the skill. A skill that throws is reported as a failed {@link SkillResult}.
 */
public class ActionGateway {

    private static final Logger log = LoggerFactory.getLogger(ActionGateway.class);

    private final SkillRegistry     skills;
    private final PermissionEngine  permissionEngine;
    private final DenialTracker     denialTracker;
    private final IdentityProvider  identityProvider;

    public ActionGateway(SkillRegistry skills,
                         PermissionEngine permissionEngine,
                         DenialTracker denialTracker,
                         IdentityProvider identityProvider) {
        this.skills           = skills;
        this.permissionEngine = permissionEngine;
        this.denialTracker    = denialTracker;
        this.identityProvider = identityProvider;
    }

    public GatewayResult invoke(String skillName, Map<String, Object> payload) {
        Skill skill = skills.find(skillName).orElse(null);
        if (skill == null) {
            log.warn("[ActionGateway] UNKNOWN_SKILL skill={}", skillName);
            return GatewayResult.unknown(skillName);
        }
        Map<String, Object> safePayload = payload != null ? payload : Map.of();

        if (skill.exempt()) {
            log.debug("[ActionGateway] EXEMPT skill={} (no permission check)", skillName);
            return GatewayResult.executed(skillName, null, run(skill, safePayload));
        }

        PermissionDecision decision = permissionEngine.check(
            skill.permission(), skillName, identityProvider.get());

        if (!decision.allowed()) {
            denialTracker.recordDenial(decision.denial());
            denialTracker.checkDrift();
            return GatewayResult.denied(skillName, decision);
        }

        denialTracker.recordAllow();
        log.info("[ActionGateway] ALLOWED skill={} permission={} overlap={} sovereignty={}",
            skillName, skill.permission(), decision.overlap(), decision.sovereignty());
        return GatewayResult.executed(skillName, decision, run(skill, safePayload));
    }

    public SkillRegistry skills() {
        return skills;
    }

    // ── Dispatch ─────────────────────────────────────────────────────────

    private SkillResult run(Skill skill, Map<String, Object> payload) {
        try {
            SkillResult result = skill.accept(new Dispatcher(payload));
            return result != null ? result : SkillResult.failure("Skill " + skill.name() + " returned no result");
        } catch (RuntimeException e) {
            log.error("[ActionGateway] skill={} threw during execution", skill.name(), e);
            return SkillResult.failure("Skill " + skill.name() + " failed: " + e.getMessage());
        }
    }

    private record Dispatcher(Map<String, Object> payload) implements Skill.Visitor<SkillResult> {

        @Override
        public SkillResult executable(ExecutableSkill skill) {
            return skill.handler().apply(payload);
        }

        @Override
        public SkillResult categorizer(CategorizerSkill skill) {
            List<TrustCategory> categories = skill.categorizer().apply(text(payload));
            return SkillResult.ok("categorized", Map.of("categories", categories));
        }

        @Override
        public SkillResult trainer(TrainerSkill skill) {
            List<TrustCategory> labels = labels(payload.get("categories"));
            if (labels.isEmpty()) {
                return SkillResult.failure("Trainer " + skill.name() + " needs at least one category label");
            }
            int learned = skill.trainer().train(text(payload), labels);
            return SkillResult.ok("trained", Map.of("learned", learned));
        }

        private static String text(Map<String, Object> payload) {
            Object text = payload.get("text");
            return text != null ? text.toString() : "";
        }

        private static List<TrustCategory> labels(Object raw) {
            List<TrustCategory> out = new ArrayList<>();
            if (raw instanceof Collection<?> values) {
                for (Object v : values) {
                    if (v instanceof TrustCategory c) {
                        out.add(c);
                    } else if (v != null) {
                        TrustCategory.fromKey(v.toString()).ifPresent(out::add);
                    }
                }
            }
            return out;
        }
    }
}
