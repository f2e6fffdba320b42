package com.trustgate.common.gateway;

import com.trustgate.common.denial.DenialTracker;
import com.trustgate.common.identity.StaticIdentityProvider;
import com.trustgate.common.model.DenialEvent;
import com.trustgate.common.model.Identity;
import com.trustgate.common.model.TrustCategory;
import com.trustgate.common.permission.PermissionEngine;
import com.trustgate.common.permission.RequirementTable;
import com.trustgate.common.skill.CategorizerSkill;
import com.trustgate.common.skill.ExecutableSkill;
import com.trustgate.common.skill.KeywordCategorizer;
import com.trustgate.common.skill.SkillResult;
import com.trustgate.common.skill.TrainerSkill;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ActionGatewayTest {

    private StaticIdentityProvider identity;
    private List<DenialEvent> denials;
    private AtomicInteger drifts;
    private AtomicInteger pushes;
    private DenialTracker tracker;
    private KeywordCategorizer categorizer;
    private ActionGateway gateway;

    @BeforeEach
    void setUp() {
        identity = new StaticIdentityProvider(Identity.uniform(0.9, 0.9));
        denials = new ArrayList<>();
        drifts = new AtomicInteger();
        pushes = new AtomicInteger();
        tracker = new DenialTracker(denials::add, drifts::incrementAndGet);
        categorizer = new KeywordCategorizer();

        SkillRegistry registry = new SkillRegistry(List.of(
            new ExecutableSkill("git", "git_push", payload -> {
                pushes.incrementAndGet();
                return SkillResult.ok("pushed " + payload.getOrDefault("branch", "main"));
            }),
            new ExecutableSkill("flaky", "file_read", payload -> {
                throw new IllegalStateException("disk gone");
            }),
            new ExecutableSkill("cron", "nightly_report", payload -> SkillResult.ok("ran")),
            new CategorizerSkill("categorize", null, categorizer::categorize),
            new TrainerSkill("train", null, categorizer::learn)
        ));
        gateway = new ActionGateway(registry,
            new PermissionEngine(RequirementTable.defaults()), tracker, identity);
    }

    @Nested
    @DisplayName("permission gate")
    class GateTests {

        @Test
        @DisplayName("trusted identity → skill runs, result returned as-is")
        void allowedRuns() {
            GatewayResult r = gateway.invoke("git", Map.of("branch", "release"));

            assertEquals(GatewayStatus.EXECUTED, r.status());
            assertTrue(r.success());
            assertEquals("pushed release", r.result().message());
            assertTrue(r.permission().allowed());
            assertEquals(1, pushes.get());
        }

        @Test
        @DisplayName("low identity → denied, skill not run, denial recorded")
        void deniedDoesNotRun() {
            identity.set(Identity.uniform(0.2, 0.2));

            GatewayResult r = gateway.invoke("git", Map.of());

            assertTrue(r.denied());
            assertFalse(r.success());
            assertEquals(0, pushes.get());
            assertEquals(1, denials.size());
            assertEquals("git", denials.get(0).skill());
            assertTrue(r.result().message().startsWith("Permission denied"));
        }

        @Test
        @DisplayName("three denials → drift escalation; an allow afterwards resets the streak")
        void driftAfterThree() {
            identity.set(Identity.uniform(0.2, 0.2));
            gateway.invoke("git", Map.of());
            gateway.invoke("git", Map.of());
            gateway.invoke("git", Map.of());
            assertEquals(1, drifts.get());

            identity.set(Identity.uniform(0.9, 0.9));
            gateway.invoke("git", Map.of());
            assertEquals(0, tracker.stats().consecutiveDenials());
            assertEquals(3, tracker.stats().totalDenials());
        }

        @Test
        @DisplayName("unregistered permission → fail-open execution")
        void unregisteredPermission() {
            identity.set(Identity.uniform(0.0, 0.0));

            GatewayResult r = gateway.invoke("cron", null);

            assertTrue(r.success());
            assertFalse(r.permission().registered());
        }

        @Test
        @DisplayName("unknown skill → UNKNOWN_SKILL, nothing recorded")
        void unknownSkill() {
            GatewayResult r = gateway.invoke("teleport", Map.of());

            assertEquals(GatewayStatus.UNKNOWN_SKILL, r.status());
            assertNull(r.permission());
            assertEquals(0, tracker.stats().totalDenials());
        }

        @Test
        @DisplayName("throwing skill → failed result, no exception")
        void throwingSkill() {
            GatewayResult r = gateway.invoke("flaky", Map.of());

            assertEquals(GatewayStatus.EXECUTED, r.status());
            assertFalse(r.success());
            assertTrue(r.result().message().contains("disk gone"));
        }
    }

    @Nested
    @DisplayName("exempt skills")
    class ExemptTests {

        @Test
        @DisplayName("categorizer runs without a check even for a zero identity")
        void categorizerExempt() {
            identity.set(Identity.uniform(0.0, 0.0));

            GatewayResult r = gateway.invoke("categorize", Map.of("text", "run the regression tests"));

            assertTrue(r.success());
            assertNull(r.permission());
            assertEquals(List.of(TrustCategory.TESTING), r.result().data().get("categories"));
            assertEquals(0, tracker.stats().totalDenials());
        }

        @Test
        @DisplayName("trainer teaches the categorizer new keywords")
        void trainerLearns() {
            GatewayResult r = gateway.invoke("train",
                Map.of("text", "terraform plan", "categories", List.of("risk_assessment")));

            assertTrue(r.success());
            assertTrue((Integer) r.result().data().get("learned") > 0);
            assertEquals(List.of(TrustCategory.RISK_ASSESSMENT), categorizer.categorize("terraform apply"));
        }

        @Test
        @DisplayName("trainer without labels → failed result")
        void trainerNeedsLabels() {
            GatewayResult r = gateway.invoke("train", Map.of("text", "terraform plan"));

            assertEquals(GatewayStatus.EXECUTED, r.status());
            assertFalse(r.success());
        }
    }

    @Test
    @DisplayName("duplicate skill names → IllegalArgumentException")
    void duplicateSkills() {
        assertThrows(IllegalArgumentException.class, () -> new SkillRegistry(List.of(
            new ExecutableSkill("x", "a", p -> SkillResult.ok("")),
            new ExecutableSkill("x", "b", p -> SkillResult.ok("")))));
    }
}
