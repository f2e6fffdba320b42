package com.trustgate.common.prediction;

import com.trustgate.common.model.TrustCategory;
import com.trustgate.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-room, timeout-gated execution of proposed actions ("ask and predict").
 *
 * <h3>Room state machine</h3>
 * <pre>
 *   IDLE → PENDING → { COMPLETED | REDIRECTED | ABORTED } → IDLE
 * </pre>
 *
 * <h3>Signal priority</h3>
 * <ol>
 *   <li>privileged event: runs at once, supersedes whatever the room had pending</li>
 *   <li>redirect: cancels the pending prediction</li>
 *   <li>bless: promotes a pending prediction to immediate execution</li>
 *   <li>countdown timeout: runs the pending prediction autonomously</li>
 * </ol>
 *
 * <h3>Concurrency</h3>
 * <p>Every transition for a room runs under that room's monitor. Each room carries a
 * {@code generation} that is replaced on every create, cancel, supersede and bless; an armed timer
 * captured the generation it was created with and does nothing if the room has moved on. Timer
 * disposal is attempted too, but correctness never depends on it.
 *
 * <p>Generations are drawn from one scheduler-wide counter, so they never repeat. A room slot is
 * dropped from the map as soon as it goes idle; a retired slot is never reused, and a caller that
 * finds one retired after taking its monitor looks the room up again.
 *
 * <p>{@link #abortAll()} holds the write side of a scheduler-wide lock while every other
 * transition holds the read side, so no prediction can be created or claimed while an abort runs.
 *
 * <p>The execute callback always runs outside every lock. Timer fires execute on the injected
 * {@link Scheduler}; exceptions there are caught so one room cannot break another.
 */
public class PredictionScheduler {

    private static final Logger log = LoggerFactory.getLogger(PredictionScheduler.class);

    private final SovereigntyTimeoutPolicy timeoutPolicy;
    private final SteeringSettings         settings;
    private final ExecuteCallback          executeCallback;
    private final NotifyCallback           notifyCallback;
    private final Scheduler                timerScheduler;
    private final Clock                    clock;

    private final ConcurrentHashMap<String, RoomSlot>       rooms            = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String>         roomByPrediction = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RecentRedirect> recentRedirects  = new ConcurrentHashMap<>();
    private final AtomicInteger                             pendingCount     = new AtomicInteger();
    private final AtomicLong                                sequence         = new AtomicLong();
    private final AtomicLong                                generations      = new AtomicLong();
    private final ReentrantReadWriteLock                    lifecycle        = new ReentrantReadWriteLock();

    public PredictionScheduler(SovereigntyTimeoutPolicy timeoutPolicy,
                               SteeringSettings settings,
                               ExecuteCallback executeCallback,
                               NotifyCallback notifyCallback,
                               Scheduler timerScheduler,
                               Clock clock) {
        this.timeoutPolicy   = Objects.requireNonNull(timeoutPolicy, "timeoutPolicy");
        this.settings        = Objects.requireNonNull(settings, "settings");
        this.executeCallback = Objects.requireNonNull(executeCallback, "executeCallback");
        this.notifyCallback  = notifyCallback != null ? notifyCallback : NotifyCallback.NOOP;
        this.timerScheduler  = Objects.requireNonNull(timerScheduler, "timerScheduler");
        this.clock           = Objects.requireNonNull(clock, "clock");
    }

    /** Mutable room state. Guarded by its own monitor. */
    private static final class RoomSlot {
        long       generation;
        Prediction pending;
        Disposable timer;
        boolean    retired;
    }

    /** The last prediction a redirect cancelled in a room, kept for the grace window. */
    private record RecentRedirect(String predictionId, Instant at) {}

    // ── Inbound events ─────────────────────────────────────────────────────

    public ScheduleOutcome handleEvent(ExecutionTier tier,
                                       String room,
                                       String contextRef,
                                       String proposedAction,
                                       List<TrustCategory> categories) {
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(room, "room");
        Objects.requireNonNull(proposedAction, "proposedAction");

        return switch (tier) {
            case PRIVILEGED           -> executePrivileged(room, contextRef, proposedAction, categories);
            case ORDINARY, SUGGESTION -> enqueue(tier, room, contextRef, proposedAction, categories);
        };
    }

    private ScheduleOutcome executePrivileged(String room, String contextRef, String action,
                                              List<TrustCategory> categories) {
        Prediction superseded;
        Prediction running;

        lifecycle.readLock().lock();
        try {
            while (true) {
                RoomSlot slot = rooms.get(room);
                if (slot == null) {
                    superseded = null;
                    running = newPrediction(ExecutionTier.PRIVILEGED, room, contextRef, action, categories, 0L,
                        generations.incrementAndGet());
                    break;
                }
                synchronized (slot) {
                    if (slot.retired) continue;
                    superseded = slot.pending != null
                        ? cancel(slot, PredictionStatus.REDIRECTED, "superseded by privileged event", true)
                        : null;
                    slot.generation = generations.incrementAndGet();
                    running = newPrediction(ExecutionTier.PRIVILEGED, room, contextRef, action, categories, 0L,
                        slot.generation);
                    retireIfIdle(room, slot);
                    break;
                }
            }
        } finally {
            lifecycle.readLock().unlock();
        }

        if (superseded != null) {
            log.info("[PredictionScheduler] PREDICTION_SUPERSEDED room={} id={} by privileged event", room, superseded.id());
            safeNotify(superseded.contextRef(), SteeringNotices.redirected(superseded));
        }

        log.info("[PredictionScheduler] PRIVILEGED_EXECUTE room={} id={} action=\"{}\"", room, running.id(), running.preview());
        ExecutionResult result = runExecute(running);
        Prediction completed = running.transition(PredictionStatus.COMPLETED, "privileged tier");
        if (!result.success()) {
            safeNotify(completed.contextRef(), SteeringNotices.failed(completed, result));
        }
        return ScheduleOutcome.completed(completed, result);
    }

    private ScheduleOutcome enqueue(ExecutionTier tier, String room, String contextRef, String action,
                                    List<TrustCategory> categories) {
        Duration timeout = tier == ExecutionTier.ORDINARY ? timeoutPolicy.currentTimeout() : Duration.ZERO;
        Prediction superseded;
        Prediction created;

        lifecycle.readLock().lock();
        try {
            while (true) {
                RoomSlot slot = rooms.computeIfAbsent(room, r -> new RoomSlot());
                synchronized (slot) {
                    if (slot.retired) continue;
                    boolean replacing = slot.pending != null;
                    if (!replacing && !tryReserve()) {
                        retireIfIdle(room, slot);
                        log.warn("[PredictionScheduler] PREDICTION_REJECTED room={} pending={} cap={}",
                            room, pendingCount.get(), settings.maxConcurrentPredictions());
                        return ScheduleOutcome.rejected(
                            "Max concurrent predictions (" + settings.maxConcurrentPredictions() + ") reached");
                    }
                    // a replaced prediction hands its reservation to the new one
                    superseded = replacing
                        ? cancel(slot, PredictionStatus.REDIRECTED, "superseded by new event", false)
                        : null;

                    slot.generation = generations.incrementAndGet();
                    created = newPrediction(tier, room, contextRef, action, categories, timeout.toMillis(),
                        slot.generation);
                    slot.pending = created;
                    roomByPrediction.put(created.id(), room);

                    if (tier == ExecutionTier.ORDINARY) {
                        slot.timer = arm(room, created.id(), slot.generation, timeout);
                    }
                    break;
                }
            }
        } finally {
            lifecycle.readLock().unlock();
        }

        if (superseded != null) {
            log.info("[PredictionScheduler] PREDICTION_SUPERSEDED room={} id={} by id={}", room, superseded.id(), created.id());
            safeNotify(superseded.contextRef(), SteeringNotices.redirected(superseded));
        }

        if (tier == ExecutionTier.ORDINARY) {
            log.info("[PredictionScheduler] PREDICTION_ARMED room={} id={} timeoutMs={} action=\"{}\"",
                room, created.id(), created.timeoutMs(), created.preview());
            safeNotify(contextRef, SteeringNotices.armed(created));
        } else {
            log.info("[PredictionScheduler] SUGGESTION_QUEUED room={} id={} action=\"{}\"", room, created.id(), created.preview());
            safeNotify(contextRef, SteeringNotices.suggested(created));
        }
        return ScheduleOutcome.pending(created);
    }

    // ── Timer ──────────────────────────────────────────────────────────────

    private Disposable arm(String room, String predictionId, long generation, Duration timeout) {
        return Mono.delay(timeout, timerScheduler)
            .subscribe(
                tick -> TraceContextUtil.withPredictionMdc(room, predictionId,
                    () -> onTimeout(room, predictionId, generation)),
                err -> log.error("[PredictionScheduler] TIMER_FAILED room={} id={}", room, predictionId, err)
            );
    }

    private void onTimeout(String room, String predictionId, long generation) {
        try {
            Prediction claimed;
            lifecycle.readLock().lock();
            try {
                RoomSlot slot = rooms.get(room);
                if (slot == null) return;
                synchronized (slot) {
                    if (slot.generation != generation
                        || slot.pending == null
                        || !slot.pending.id().equals(predictionId)) {
                        log.debug("[PredictionScheduler] STALE_TIMER_IGNORED room={} id={} capturedGeneration={} currentGeneration={}",
                            room, predictionId, generation, slot.generation);
                        return;
                    }
                    claimed = slot.pending.transition(PredictionStatus.COMPLETED, "timeout reached");
                    release(slot);
                    retireIfIdle(room, slot);
                }
            } finally {
                lifecycle.readLock().unlock();
            }

            log.info("[PredictionScheduler] PREDICTION_EXECUTING room={} id={} (timeout reached)", room, predictionId);
            safeNotify(claimed.contextRef(), SteeringNotices.executing(claimed));
            ExecutionResult result = runExecute(claimed);
            if (!result.success()) {
                safeNotify(claimed.contextRef(), SteeringNotices.failed(claimed, result));
            }
        } catch (RuntimeException e) {
            log.error("[PredictionScheduler] TIMER_CALLBACK_FAILED room={} id={}", room, predictionId, e);
        }
    }

    // ── Human signals ──────────────────────────────────────────────────────

    /**
     * Cancels the room's pending prediction. A pending prediction is always cancelled, however
     * recently the room was last redirected. With nothing pending, a repeat of a redirect that
     * landed within the grace window is absorbed as a duplicate.
     *
     * @return the redirected prediction, or empty when this call was a no-op
     */
    public Optional<Prediction> redirect(String room, String reason) {
        Instant now = clock.instant();
        forgetExpiredRedirects(now);
        Prediction redirected = null;

        lifecycle.readLock().lock();
        try {
            while (true) {
                RoomSlot slot = rooms.get(room);
                if (slot == null) break;
                synchronized (slot) {
                    if (slot.retired) continue;
                    if (slot.pending != null) {
                        redirected = cancel(slot, PredictionStatus.REDIRECTED,
                            reason != null ? reason : "redirected", true);
                        retireIfIdle(room, slot);
                        recentRedirects.put(room, new RecentRedirect(redirected.id(), now));
                    }
                    break;
                }
            }
        } finally {
            lifecycle.readLock().unlock();
        }

        if (redirected == null) {
            RecentRedirect recent = recentRedirects.get(room);
            if (recent != null && withinGrace(recent.at(), now)) {
                log.info("[PredictionScheduler] REDIRECT_DEDUPLICATED room={} id={} withinMs={}",
                    room, recent.predictionId(), settings.redirectGrace().toMillis());
            } else {
                log.debug("[PredictionScheduler] REDIRECT_NOTHING_PENDING room={}", room);
            }
            return Optional.empty();
        }

        log.info("[PredictionScheduler] PREDICTION_REDIRECTED room={} id={} reason=\"{}\"",
            room, redirected.id(), redirected.reason());
        safeNotify(redirected.contextRef(), SteeringNotices.redirected(redirected));
        return Optional.of(redirected);
    }

    /**
     * Promotes a pending prediction to immediate execution. Skips the countdown only; the
     * execute callback still routes through the permission gate.
     */
    public BlessOutcome bless(String predictionId, String actor) {
        Prediction claimed;

        lifecycle.readLock().lock();
        try {
            String room = roomByPrediction.get(predictionId);
            RoomSlot slot = room != null ? rooms.get(room) : null;
            if (slot == null) return BlessOutcome.notFound();
            synchronized (slot) {
                if (slot.retired || slot.pending == null || !slot.pending.id().equals(predictionId)) {
                    return BlessOutcome.notFound();
                }
                claimed = cancel(slot, PredictionStatus.COMPLETED, "blessed by " + actor, true);
                retireIfIdle(room, slot);
            }
        } finally {
            lifecycle.readLock().unlock();
        }

        log.info("[PredictionScheduler] PREDICTION_BLESSED room={} id={} actor={}", claimed.room(), predictionId, actor);
        safeNotify(claimed.contextRef(), SteeringNotices.blessed(claimed, actor));
        ExecutionResult result = runExecute(claimed);
        if (!result.success()) {
            safeNotify(claimed.contextRef(), SteeringNotices.failed(claimed, result));
        }
        return new BlessOutcome(true, claimed, result);
    }

    /**
     * Emergency stop. When this returns no prediction is pending and no timer armed before the
     * call can still reach the execute callback.
     *
     * @return number of predictions aborted
     */
    public int abortAll() {
        List<Prediction> aborted = new ArrayList<>();

        lifecycle.writeLock().lock();
        try {
            for (RoomSlot slot : rooms.values()) {
                synchronized (slot) {
                    if (slot.pending != null) {
                        aborted.add(cancel(slot, PredictionStatus.ABORTED, "emergency stop", true));
                    }
                    slot.retired = true;
                }
            }
            rooms.clear();
            recentRedirects.clear();
        } finally {
            lifecycle.writeLock().unlock();
        }

        log.warn("[PredictionScheduler] ABORT_ALL aborted={}", aborted.size());
        aborted.forEach(p -> safeNotify(p.contextRef(), SteeringNotices.aborted(p)));
        return aborted.size();
    }

    // ── Introspection ──────────────────────────────────────────────────────

    public boolean hasPending(String room) {
        RoomSlot slot = rooms.get(room);
        if (slot == null) return false;
        synchronized (slot) {
            return slot.pending != null;
        }
    }

    public Optional<Prediction> pending(String room) {
        RoomSlot slot = rooms.get(room);
        if (slot == null) return Optional.empty();
        synchronized (slot) {
            return Optional.ofNullable(slot.pending);
        }
    }

    /** Pending predictions across all rooms, oldest first. */
    public List<Prediction> listPending() {
        List<Prediction> out = new ArrayList<>();
        for (Map.Entry<String, RoomSlot> e : rooms.entrySet()) {
            RoomSlot slot = e.getValue();
            synchronized (slot) {
                if (slot.pending != null) out.add(slot.pending);
            }
        }
        out.sort(Comparator.comparing(Prediction::createdAt).thenComparing(Prediction::id));
        return out;
    }

    public int pendingCount() {
        return pendingCount.get();
    }

    /** Rooms currently holding state. Idle rooms are not tracked. */
    public int trackedRooms() {
        return rooms.size();
    }

    public SteeringSettings settings() {
        return settings;
    }

    // ── Internals (callers hold the room monitor) ─────────────────────────

    /**
     * Moves the room's pending prediction to {@code status}, bumps the generation and disposes the
     * timer. With {@code releaseReservation} false the global reservation is kept for a successor.
     */
    private Prediction cancel(RoomSlot slot, PredictionStatus status, String reason, boolean releaseReservation) {
        Prediction ended = slot.pending.transition(status, reason);
        slot.generation = generations.incrementAndGet();
        if (slot.timer != null) {
            slot.timer.dispose();
        }
        if (releaseReservation) {
            release(slot);
        } else {
            roomByPrediction.remove(ended.id());
            slot.pending = null;
            slot.timer = null;
        }
        return ended;
    }

    private void release(RoomSlot slot) {
        roomByPrediction.remove(slot.pending.id());
        slot.pending = null;
        slot.timer = null;
        pendingCount.decrementAndGet();
    }

    /** Drops an idle slot from the map. The caller holds the slot's monitor. */
    private void retireIfIdle(String room, RoomSlot slot) {
        if (slot.pending != null) return;
        slot.retired = true;
        rooms.remove(room, slot);
    }

    private boolean withinGrace(Instant at, Instant now) {
        return Duration.between(at, now).compareTo(settings.redirectGrace()) < 0;
    }

    private void forgetExpiredRedirects(Instant now) {
        recentRedirects.values().removeIf(r -> !withinGrace(r.at(), now));
    }

    private boolean tryReserve() {
        int cap = settings.maxConcurrentPredictions();
        while (true) {
            int current = pendingCount.get();
            if (current >= cap) return false;
            if (pendingCount.compareAndSet(current, current + 1)) return true;
        }
    }

    private Prediction newPrediction(ExecutionTier tier, String room, String contextRef, String action,
                                     List<TrustCategory> categories, long timeoutMs, long generation) {
        Instant now = clock.instant();
        String id = "pred-" + sequence.incrementAndGet() + "-" + now.toEpochMilli();
        return new Prediction(id, room, tier, contextRef, now, timeoutMs, action, categories,
            PredictionStatus.PENDING, generation, null);
    }

    private ExecutionResult runExecute(Prediction prediction) {
        try {
            boolean ok = executeCallback.execute(prediction.room(), prediction.proposedAction());
            if (ok) return ExecutionResult.succeeded();
            log.warn("[PredictionScheduler] EXECUTION_FAILED room={} id={} callback reported failure", prediction.room(), prediction.id());
            return ExecutionResult.failed("execute callback reported failure");
        } catch (RuntimeException e) {
            log.error("[PredictionScheduler] EXECUTION_FAILED room={} id={}", prediction.room(), prediction.id(), e);
            return ExecutionResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void safeNotify(String contextRef, String message) {
        if (contextRef == null) return;
        try {
            notifyCallback.notify(contextRef, message);
        } catch (RuntimeException e) {
            log.warn("[PredictionScheduler] NOTIFY_FAILED contextRef={}", contextRef, e);
        }
    }
}
