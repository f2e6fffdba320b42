package com.trustgate.common.prediction;

import com.trustgate.common.identity.StaticIdentityProvider;
import com.trustgate.common.model.Identity;
import com.trustgate.common.model.TrustCategory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Timing behaviour of {@link PredictionScheduler} on virtual time. Countdowns never wait on the
 * wall clock; {@link VirtualTimeScheduler#advanceTimeBy} drives every timer fire.
 */
class PredictionSchedulerTest {

    private VirtualTimeScheduler vts;
    private StaticIdentityProvider identity;
    private List<String> executed;
    private List<String> notices;
    private boolean executeResult;
    private RuntimeException executeFailure;
    private PredictionScheduler scheduler;

    /** Clock that reads the virtual scheduler, so grace windows track advanceTimeBy. */
    private final class VirtualClock extends Clock {
        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return Instant.ofEpochMilli(vts.now(TimeUnit.MILLISECONDS)); }
    }

    @BeforeEach
    void setUp() {
        vts = VirtualTimeScheduler.create();
        identity = new StaticIdentityProvider(Identity.uniform(0.7, 0.65)); // moderate → 30 s
        executed = Collections.synchronizedList(new ArrayList<>());
        notices = Collections.synchronizedList(new ArrayList<>());
        executeResult = true;
        executeFailure = null;
        scheduler = newScheduler(SteeringSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        vts.dispose();
    }

    private PredictionScheduler newScheduler(SteeringSettings settings) {
        ExecuteCallback execute = (room, action) -> {
            if (executeFailure != null) throw executeFailure;
            executed.add(room + ":" + action);
            return executeResult;
        };
        return new PredictionScheduler(new SovereigntyTimeoutPolicy(identity), settings, execute,
            (ref, message) -> notices.add(ref + "|" + message), vts, new VirtualClock());
    }

    private ScheduleOutcome ordinary(String room, String action) {
        return scheduler.handleEvent(ExecutionTier.ORDINARY, room, "ctx-" + room, action,
            List.of(TrustCategory.CODE_QUALITY));
    }

    private void advance(long millis) {
        vts.advanceTimeBy(Duration.ofMillis(millis));
    }

    // ── Countdown ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("ordinary tier — countdown")
    class CountdownTests {

        @Test
        @DisplayName("sovereignty 0.65 → 30 s countdown, executes once at timeout")
        void executesAtTimeout() {
            ScheduleOutcome outcome = ordinary("R1", "git push origin main");

            assertEquals(ScheduleStatus.PENDING, outcome.status());
            assertEquals(30_000, outcome.prediction().timeoutMs());
            assertTrue(scheduler.hasPending("R1"));

            advance(29_999);
            assertTrue(executed.isEmpty());

            advance(1);
            assertEquals(List.of("R1:git push origin main"), executed);
            assertFalse(scheduler.hasPending("R1"));
            assertEquals(0, scheduler.pendingCount());

            advance(120_000);
            assertEquals(1, executed.size());
        }

        @Test
        @DisplayName("timeout is fixed at creation; a later identity change does not shorten it")
        void timeoutFixedAtCreation() {
            ordinary("R1", "deploy");
            identity.set(Identity.uniform(0.9, 0.95));

            advance(5_000);
            assertTrue(executed.isEmpty());

            advance(25_000);
            assertEquals(1, executed.size());
        }

        @Test
        @DisplayName("armed notice goes to the context reference")
        void armedNotice() {
            ordinary("R1", "deploy");
            assertEquals(1, notices.size());
            assertTrue(notices.get(0).startsWith("ctx-R1|PREDICTION [R1]"));
            assertTrue(notices.get(0).contains("Proceeding in 30s"));
        }

        @Test
        @DisplayName("new ordinary event supersedes the room's pending prediction")
        void supersedesInRoom() {
            ordinary("R1", "first");
            advance(20_000);
            ScheduleOutcome second = ordinary("R1", "second");

            assertEquals(1, scheduler.listPending().size());
            assertEquals(1, scheduler.pendingCount());

            advance(10_000); // first timer's deadline
            assertTrue(executed.isEmpty());

            advance(20_000);
            assertEquals(List.of("R1:second"), executed);
            assertEquals(ScheduleStatus.PENDING, second.status());
            assertTrue(notices.stream().anyMatch(n -> n.contains("REDIRECTED [R1]") && n.contains("superseded")));
        }
    }

    // ── Redirect ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("redirect()")
    class RedirectTests {

        @Test
        @DisplayName("redirect at t=10 s → REDIRECTED, never executed even after t=30 s")
        void redirectCancels() {
            ordinary("R1", "rm -rf build");
            advance(10_000);

            Optional<Prediction> redirected = scheduler.redirect("R1", "wrong branch");

            assertTrue(redirected.isPresent());
            assertEquals(PredictionStatus.REDIRECTED, redirected.get().status());
            assertEquals("wrong branch", redirected.get().reason());

            advance(60_000);
            assertTrue(executed.isEmpty());
            assertFalse(scheduler.hasPending("R1"));
            assertEquals(0, scheduler.pendingCount());
        }

        @Test
        @DisplayName("no pending prediction → no-op")
        void nothingPending() {
            assertTrue(scheduler.redirect("R9", "anything").isEmpty());
        }

        @Test
        @DisplayName("a new prediction right after a redirect can still be redirected at once")
        void newPredictionInsideGraceIsRedirected() {
            identity.set(Identity.uniform(0.9, 0.9)); // high trust → 5 s countdown
            ordinary("R1", "first");
            assertTrue(scheduler.redirect("R1", "stop").isPresent());

            ordinary("R1", "second");
            advance(1_000);
            Optional<Prediction> second = scheduler.redirect("R1", "stop again");

            assertTrue(second.isPresent());
            assertEquals("second", second.get().proposedAction());
            advance(5_000);
            assertTrue(executed.isEmpty());
            assertEquals(0, scheduler.pendingCount());
        }

        @Test
        @DisplayName("repeat redirect inside the grace window → no-op, no second notice")
        void repeatInsideGraceIsAbsorbed() {
            ordinary("R1", "first");
            assertTrue(scheduler.redirect("R1", "stop").isPresent());
            advance(1_000);

            assertTrue(scheduler.redirect("R1", "stop").isEmpty());
            assertEquals(1, notices.stream().filter(n -> n.contains("REDIRECTED [R1]")).count());

            advance(10_000);
            assertTrue(scheduler.redirect("R1", "stop").isEmpty());
        }
    }

    // ── Privileged ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("privileged tier")
    class PrivilegedTests {

        @Test
        @DisplayName("runs synchronously without a countdown")
        void runsImmediately() {
            ScheduleOutcome outcome = scheduler.handleEvent(ExecutionTier.PRIVILEGED, "R2", "ctx", "deploy", List.of());

            assertEquals(ScheduleStatus.COMPLETED, outcome.status());
            assertTrue(outcome.execution().success());
            assertEquals(PredictionStatus.COMPLETED, outcome.prediction().status());
            assertEquals(List.of("R2:deploy"), executed);
            assertEquals(0, scheduler.pendingCount());
        }

        @Test
        @DisplayName("supersedes the room's pending prediction; no double execution")
        void supersedesPending() {
            ordinary("R2", "ordinary action");
            advance(5_000);

            scheduler.handleEvent(ExecutionTier.PRIVILEGED, "R2", "ctx", "privileged action", List.of());

            assertEquals(List.of("R2:privileged action"), executed);
            assertFalse(scheduler.hasPending("R2"));

            advance(60_000);
            assertEquals(List.of("R2:privileged action"), executed);
            assertEquals(0, scheduler.pendingCount());
        }

        @Test
        @DisplayName("ignores the concurrency cap")
        void ignoresCap() {
            scheduler = newScheduler(new SteeringSettings(1, Duration.ofSeconds(5)));
            ordinary("A", "one");

            ScheduleOutcome outcome = scheduler.handleEvent(ExecutionTier.PRIVILEGED, "B", "ctx", "two", List.of());

            assertEquals(ScheduleStatus.COMPLETED, outcome.status());
        }
    }

    // ── Cap ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("concurrency cap")
    class CapTests {

        @Test
        @DisplayName("fourth room is rejected at cap 3; capacity frees after a timeout")
        void rejectsAtCap() {
            ordinary("A", "a");
            ordinary("B", "b");
            ordinary("C", "c");

            ScheduleOutcome rejected = ordinary("D", "d");
            assertEquals(ScheduleStatus.REJECTED, rejected.status());
            assertNull(rejected.prediction());
            assertTrue(rejected.reason().contains("3"));
            assertEquals(3, scheduler.pendingCount());

            advance(30_000);
            assertEquals(ScheduleStatus.PENDING, ordinary("D", "d").status());
        }

        @Test
        @DisplayName("replacing a room's prediction at cap is not rejected")
        void replaceAtCap() {
            ordinary("A", "a");
            ordinary("B", "b");
            ordinary("C", "c");

            assertEquals(ScheduleStatus.PENDING, ordinary("A", "a2").status());
            assertEquals(3, scheduler.pendingCount());
        }
    }

    // ── Suggestion + bless ────────────────────────────────────────────────

    @Nested
    @DisplayName("bless()")
    class BlessTests {

        @Test
        @DisplayName("bless executes immediately and the stale timer does nothing")
        void blessExecutes() {
            Prediction p = ordinary("R1", "merge PR").prediction();
            advance(2_000);

            BlessOutcome outcome = scheduler.bless(p.id(), "alice");

            assertTrue(outcome.success());
            assertEquals(PredictionStatus.COMPLETED, outcome.prediction().status());
            assertEquals("blessed by alice", outcome.prediction().reason());
            assertEquals(List.of("R1:merge PR"), executed);

            advance(60_000);
            assertEquals(1, executed.size());
        }

        @Test
        @DisplayName("unknown or already-completed id → not found")
        void notFound() {
            Prediction p = ordinary("R1", "merge PR").prediction();
            advance(30_000);

            assertFalse(scheduler.bless(p.id(), "alice").found());
            assertFalse(scheduler.bless("pred-nope", "alice").found());
            assertEquals(1, executed.size());
        }

        @Test
        @DisplayName("suggestion waits without a countdown until blessed")
        void suggestionWaits() {
            ScheduleOutcome outcome = scheduler.handleEvent(ExecutionTier.SUGGESTION, "R3", "ctx", "tidy docs", List.of());
            assertEquals(0, outcome.prediction().timeoutMs());

            advance(600_000);
            assertTrue(executed.isEmpty());
            assertTrue(scheduler.hasPending("R3"));

            assertTrue(scheduler.bless(outcome.prediction().id(), "bob").success());
            assertEquals(List.of("R3:tidy docs"), executed);
        }

        @Test
        @DisplayName("execute callback reporting failure → bless outcome carries the error")
        void blessFailure() {
            executeResult = false;
            Prediction p = ordinary("R1", "deploy").prediction();

            BlessOutcome outcome = scheduler.bless(p.id(), "alice");

            assertTrue(outcome.found());
            assertFalse(outcome.success());
            assertNotNull(outcome.execution().error());
            assertTrue(notices.stream().anyMatch(n -> n.contains("FAILED [R1]")));
        }
    }

    // ── Abort ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("abortAll()")
    class AbortTests {

        @Test
        @DisplayName("aborts every pending prediction; nothing executes afterwards")
        void abortsEverything() {
            ordinary("A", "a");
            ordinary("B", "b");
            scheduler.handleEvent(ExecutionTier.SUGGESTION, "C", "ctx", "c", List.of());

            assertEquals(3, scheduler.abortAll());

            advance(120_000);
            assertTrue(executed.isEmpty());
            assertTrue(scheduler.listPending().isEmpty());
            assertEquals(0, scheduler.pendingCount());
            assertEquals(3, notices.stream().filter(n -> n.contains("ABORTED")).count());
        }

        @Test
        @DisplayName("scheduler keeps accepting events after an abort")
        void acceptsAfterAbort() {
            ordinary("A", "a");
            scheduler.abortAll();

            ordinary("A", "again");
            advance(30_000);

            assertEquals(List.of("A:again"), executed);
        }

        @Test
        @DisplayName("nothing pending → 0")
        void emptyAbort() {
            assertEquals(0, scheduler.abortAll());
        }
    }

    // ── Room slots ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("room slot lifecycle")
    class RoomSlotTests {

        @Test
        @DisplayName("rooms that go idle are no longer tracked")
        void idleRoomsDropped() {
            Prediction blessed = ordinary("A", "a").prediction();
            ordinary("B", "b");
            scheduler.handleEvent(ExecutionTier.SUGGESTION, "C", "ctx", "c", List.of());
            scheduler.handleEvent(ExecutionTier.PRIVILEGED, "D", "ctx", "d", List.of());
            assertEquals(3, scheduler.trackedRooms());

            scheduler.bless(blessed.id(), "alice");
            scheduler.redirect("C", "no");
            assertEquals(1, scheduler.trackedRooms());

            advance(30_000);
            assertEquals(0, scheduler.trackedRooms());
        }

        @Test
        @DisplayName("rejected event at cap leaves no slot behind")
        void rejectedLeavesNoSlot() {
            scheduler = newScheduler(new SteeringSettings(1, Duration.ofSeconds(5)));
            ordinary("A", "a");

            for (int i = 0; i < 50; i++) {
                assertEquals(ScheduleStatus.REJECTED, ordinary("room-" + i, "x").status());
            }
            assertEquals(1, scheduler.trackedRooms());
        }

        @Test
        @DisplayName("timer of a retired room is inert against the room's next prediction")
        void staleTimerAfterRecreate() {
            Prediction first = ordinary("R1", "first").prediction();
            scheduler.redirect("R1", "no");
            assertEquals(0, scheduler.trackedRooms());

            advance(10_000);
            Prediction second = ordinary("R1", "second").prediction();
            assertTrue(second.generation() > first.generation());

            advance(20_000); // first timer's deadline
            assertTrue(executed.isEmpty());
            assertTrue(scheduler.hasPending("R1"));

            advance(10_000);
            assertEquals(List.of("R1:second"), executed);
        }
    }

    // ── Isolation ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("callback isolation")
    class IsolationTests {

        @Test
        @DisplayName("a throwing execute callback does not stop other rooms' timers")
        void throwingExecute() {
            ordinary("A", "a");
            advance(1_000);
            ordinary("B", "b");

            executeFailure = new IllegalStateException("worker down");
            advance(29_000);
            executeFailure = null;
            advance(1_000);

            assertEquals(List.of("B:b"), executed);
            assertTrue(notices.stream().anyMatch(n -> n.contains("FAILED [A]") && n.contains("worker down")));
        }

        @Test
        @DisplayName("a throwing notify callback does not block scheduling or execution")
        void throwingNotify() {
            scheduler = new PredictionScheduler(new SovereigntyTimeoutPolicy(identity), SteeringSettings.defaults(),
                (room, action) -> executed.add(room),
                (ref, message) -> { throw new IllegalStateException("channel down"); },
                vts, new VirtualClock());

            assertEquals(ScheduleStatus.PENDING,
                scheduler.handleEvent(ExecutionTier.ORDINARY, "A", "ctx", "a", List.of()).status());
            advance(30_000);

            assertEquals(List.of("A"), executed);
        }

        @Test
        @DisplayName("listPending is ordered by creation time")
        void listOrdered() {
            ordinary("B", "b");
            advance(100);
            ordinary("A", "a");

            assertEquals(List.of("B", "A"), scheduler.listPending().stream().map(Prediction::room).toList());
        }
    }
}
