package com.stmtobfuscator.infrastructure.obfuscation.pipeline;

/**
 * Outcome of one pipeline stage. A stage that hit a recoverable failure still
 * carries a usable value (its safe default) plus the reason.
 *
 * @param value   stage output, never null
 * @param failure reason the stage fell back to its default (nullable)
 */
public record StageResult<T>(T value, String failure) {

    public static <T> StageResult<T> success(T value) {
        return new StageResult<>(value, null);
    }

    public static <T> StageResult<T> recovered(T fallback, String failure) {
        return new StageResult<>(fallback, failure);
    }

    public boolean failed() {
        return failure != null;
    }
}
