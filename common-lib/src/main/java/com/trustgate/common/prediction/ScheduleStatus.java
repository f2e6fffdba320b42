package com.trustgate.common.prediction;

/** Result of {@link PredictionScheduler#handleEvent}. */
public enum ScheduleStatus {
    /** Queued; a countdown is running or a bless is awaited. */
    PENDING,
    /** Ran synchronously (privileged tier). */
    COMPLETED,
    /** Global concurrency cap reached; retry later or escalate to the privileged tier. */
    REJECTED
}
