package com.trustgate.common.denial;

import com.trustgate.common.model.DenialEvent;
import com.trustgate.common.model.DenialStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Denial counters with drift escalation.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>every denial increments {@code totalDenials} and {@code consecutiveDenials}</li>
 *   <li>any allowed action resets {@code consecutiveDenials} to 0</li>
 *   <li>at {@value #DRIFT_THRESHOLD} consecutive denials {@link #checkDrift()} fires the drift hook
 *       once and restarts the count, so the next escalation needs three <em>new</em> denials</li>
 * </ul>
 *
 * <p>Hook failures are logged and absorbed: a broken audit sink or a failed upstream
 * recompute never breaks the action path. The stale identity simply stays in effect.
 */
public class DenialTracker {

    private static final Logger log = LoggerFactory.getLogger(DenialTracker.class);

    public static final int DRIFT_THRESHOLD = 3;

    private final DenialHook denialHook;
    private final DriftHook  driftHook;
    private final int        driftThreshold;

    private final AtomicLong totalDenials     = new AtomicLong();
    private final AtomicLong driftEscalations = new AtomicLong();
    private int consecutiveDenials;

    public DenialTracker(DenialHook denialHook, DriftHook driftHook) {
        this(denialHook, driftHook, DRIFT_THRESHOLD);
    }

    public DenialTracker(DenialHook denialHook, DriftHook driftHook, int driftThreshold) {
        if (driftThreshold < 1) {
            throw new IllegalArgumentException("driftThreshold must be >= 1 but was " + driftThreshold);
        }
        this.denialHook     = denialHook != null ? denialHook : DenialHook.NOOP;
        this.driftHook      = driftHook  != null ? driftHook  : DriftHook.NOOP;
        this.driftThreshold = driftThreshold;
    }

    public void recordDenial(DenialEvent event) {
        int consecutive;
        synchronized (this) {
            consecutive = ++consecutiveDenials;
        }
        long total = totalDenials.incrementAndGet();

        log.warn("[DenialTracker] DENIAL_RECORDED {} consecutive={} total={}",
            event.summary(), consecutive, total);

        try {
            denialHook.onDenial(event);
        } catch (RuntimeException e) {
            log.error("[DenialTracker] denial hook failed. action={} skill={}", event.action(), event.skill(), e);
        }
    }

    public synchronized void recordAllow() {
        if (consecutiveDenials > 0) {
            log.info("[DenialTracker] CONSECUTIVE_RESET previous={}", consecutiveDenials);
        }
        consecutiveDenials = 0;
    }

    /**
     * Fires the drift hook when the consecutive count has reached the threshold.
     * The count is claimed and cleared atomically so concurrent callers cannot double-fire.
     *
     * @return {@code true} if the hook was invoked
     */
    public boolean checkDrift() {
        synchronized (this) {
            if (consecutiveDenials < driftThreshold) return false;
            consecutiveDenials = 0;
        }
        long escalation = driftEscalations.incrementAndGet();
        log.warn("[DenialTracker] DRIFT_ESCALATION #{} after {} consecutive denials, requesting trust recompute",
            escalation, driftThreshold);
        try {
            driftHook.onDrift();
        } catch (RuntimeException e) {
            log.error("[DenialTracker] drift hook failed; stale identity stays in effect until next reload", e);
        }
        return true;
    }

    /** Clears the consecutive count after a successful recompute cycle. Totals are kept. */
    public synchronized void reset() {
        consecutiveDenials = 0;
    }

    public synchronized DenialStats stats() {
        return new DenialStats(totalDenials.get(), consecutiveDenials, driftEscalations.get());
    }
}
