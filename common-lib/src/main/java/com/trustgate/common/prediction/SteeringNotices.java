package com.trustgate.common.prediction;

import java.util.stream.Collectors;

/** Human-visible notice text for each prediction transition. */
final class SteeringNotices {

    private SteeringNotices() {}

    static String armed(Prediction p) {
        String aligned = p.categories().isEmpty()
            ? "general"
            : p.categories().stream().map(c -> c.key()).collect(Collectors.joining(", "));
        return String.format("PREDICTION [%s]%nAction: `%s`%nAligned with: [%s]%n"
                + "Proceeding in %ds. Send a message to redirect.",
            p.room(), p.preview(), aligned, p.timeoutMs() / 1000);
    }

    static String suggested(Prediction p) {
        return String.format("SUGGESTION [%s] id=%s%nAction: `%s`%nAwaiting bless to execute.",
            p.room(), p.id(), p.preview());
    }

    static String executing(Prediction p) {
        return String.format("EXECUTING [%s]%nAction: `%s`%nNo intervention received, proceeding autonomously.",
            p.room(), p.preview());
    }

    static String redirected(Prediction p) {
        return String.format("REDIRECTED [%s]%nOriginal: `%s`%nReason: %s",
            p.room(), p.preview(), p.reason());
    }

    static String blessed(Prediction p, String actor) {
        return String.format("BLESSED by @%s [%s]%nAction: `%s`%nExecuting immediately.",
            actor, p.room(), p.preview());
    }

    static String aborted(Prediction p) {
        return String.format("ABORTED [%s]%nAction: `%s`%nReason: %s", p.room(), p.preview(), p.reason());
    }

    static String failed(Prediction p, ExecutionResult result) {
        return String.format("FAILED [%s]%nAction: `%s`%nError: %s", p.room(), p.preview(), result.error());
    }
}
