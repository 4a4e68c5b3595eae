package com.ryuqq.pipeline.core.spi;

/**
 * Result of a sandboxed snippet.
 *
 * @param success whether the snippet finished without raising
 * @param result value bound to {@code result} by the snippet, may be null
 * @param stdout captured standard output, empty when nothing was printed
 * @param error exception text when {@code success} is false
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CodeOutcome(
    boolean success,
    Object result,
    String stdout,
    String error
) {

    public CodeOutcome {
        stdout = stdout == null ? "" : stdout;
    }

    public static CodeOutcome success(Object result, String stdout) {
        return new CodeOutcome(true, result, stdout, null);
    }

    public static CodeOutcome failure(String error, String stdout) {
        return new CodeOutcome(false, null, stdout, error);
    }
}
