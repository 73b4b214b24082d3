package com.chatrelay.relay;

import com.chatrelay.providers.ChatEvent;

import java.util.Iterator;

/** An opened provider stream whose first chunk has already been checked. */
public record StreamHandle(
    String provider,
    String model,
    Iterator<ChatEvent> chunks
) implements AutoCloseable {

    /** Releases the upstream connection; safe to call more than once. */
    @Override
    public void close() {
        Dispatcher.release(provider, chunks);
    }
}
