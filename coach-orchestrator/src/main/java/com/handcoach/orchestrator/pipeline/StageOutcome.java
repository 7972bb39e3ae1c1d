package com.handcoach.orchestrator.pipeline;

/**
 * Result of a guarded stage: the value to carry forward and whether it came from the fallback.
 *
 * @param reason why the fallback was used, {@code null} on success
 */
public record StageOutcome<T>(T value, boolean fallbackUsed, String reason) {

    public static <T> StageOutcome<T> success(T value) {
        return new StageOutcome<>(value, false, null);
    }

    public static <T> StageOutcome<T> fallback(T value, String reason) {
        return new StageOutcome<>(value, true, reason);
    }
}
