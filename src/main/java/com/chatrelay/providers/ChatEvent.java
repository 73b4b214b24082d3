package com.chatrelay.providers;

/**
 * One piece of streamed provider output. {@code done} marks the last event of
 * a stream; its delta may be empty.
 */
public record ChatEvent(String delta, boolean done) {

    public static ChatEvent chunk(String delta) {
        return new ChatEvent(delta, false);
    }

    public boolean isEmpty() {
        return delta == null || delta.isEmpty();
    }
}
