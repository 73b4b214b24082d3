package com.chatrelay.relay;

import java.time.Duration;

/**
 * A prompt bound for the dispatcher. Blocking or streaming delivery is chosen
 * by calling {@link Dispatcher#dispatch} or {@link Dispatcher#openStream}.
 */
public record DispatchRequest(
    String message,
    String preferredProvider,
    Duration timeout
) {
    public DispatchRequest {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
        if (preferredProvider != null && preferredProvider.isBlank()) {
            preferredProvider = null;
        }
    }

    public static DispatchRequest of(String message, String preferredProvider, Duration timeout) {
        return new DispatchRequest(message, preferredProvider, timeout);
    }
}
