package com.chatrelay.relay;

import java.time.Duration;

/**
 * Uniform outcome of a chat call. A soft failure still reports
 * {@code success=true}; its provider ends in {@code _fallback} and its model is
 * {@code fallback}.
 */
public record DispatchResult(
    boolean success,
    String text,
    String providerUsed,
    String model,
    Duration elapsed,
    String error
) {
    public static final String FALLBACK_SUFFIX = "_fallback";
    public static final String FALLBACK_MODEL = "fallback";

    public static DispatchResult ok(String text, String provider, String model, Duration elapsed) {
        return new DispatchResult(true, text, provider, model, elapsed, null);
    }

    public static DispatchResult softFailure(String text, String requestedProvider, Duration elapsed, String error) {
        return new DispatchResult(true, text, requestedProvider + FALLBACK_SUFFIX, FALLBACK_MODEL, elapsed, error);
    }

    public boolean isFallback() {
        return providerUsed != null && providerUsed.endsWith(FALLBACK_SUFFIX);
    }

    public double elapsedSeconds() {
        return elapsed.toNanos() / 1_000_000_000.0;
    }
}
