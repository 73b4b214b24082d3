package com.chatrelay.relay;

import com.chatrelay.fallback.FallbackResponder;
import com.chatrelay.observability.RelayMetrics;
import com.chatrelay.providers.ProviderException;
import com.chatrelay.providers.ProviderFailures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Re-emits provider chunks as relay events. Every session ends with a
 * {@code done} event carrying usable text, even when the provider failed.
 */
public class StreamRelay {

    private static final Logger log = LoggerFactory.getLogger(StreamRelay.class);

    static final String FALLBACK_PROVIDER = "fallback";
    static final String FALLBACK_MODEL = "fallback-mode";

    private final Dispatcher dispatcher;
    private final FallbackResponder fallback;
    private final RelayMetrics metrics;

    public StreamRelay(Dispatcher dispatcher, FallbackResponder fallback, RelayMetrics metrics) {
        this.dispatcher = dispatcher;
        this.fallback = fallback;
        this.metrics = metrics;
    }

    /** Lazy, finite and single-use: nothing is requested upstream until the first {@code hasNext()}. */
    public RelaySession relay(DispatchRequest request) {
        return new RelaySession(request);
    }

    public enum State {
        START,
        STREAMING,
        BLOCKED,
        ERROR,
        DONE
    }

    public final class RelaySession implements Iterator<RelayEvent> {

        private final DispatchRequest request;
        private final Deque<RelayEvent> pending = new ArrayDeque<>();
        private final StringBuilder buffer = new StringBuilder();
        private final long startNanos = System.nanoTime();
        private State state = State.START;
        private StreamHandle handle;

        private RelaySession(DispatchRequest request) {
            this.request = request;
        }

        public State state() {
            return state;
        }

        @Override
        public boolean hasNext() {
            while (pending.isEmpty() && state != State.DONE && state != State.BLOCKED && state != State.ERROR) {
                advance();
            }
            return !pending.isEmpty();
        }

        @Override
        public RelayEvent next() {
            if (!hasNext()) throw new NoSuchElementException();
            return pending.poll();
        }

        private void advance() {
            if (state == State.START) {
                open();
            } else {
                pump();
            }
        }

        private void open() {
            try {
                handle = dispatcher.openStream(request);
            } catch (AllProvidersFailedException | ProviderException e) {
                log.error("Stream could not start: {}", e.getMessage());
                state = State.ERROR;
                var text = fallback.respond(request.message());
                pending.add(RelayEvent.error(ProviderFailures.describe(e)));
                pending.add(RelayEvent.text(text, FALLBACK_PROVIDER));
                pending.add(RelayEvent.done(text, FALLBACK_PROVIDER, FALLBACK_MODEL, elapsedSeconds()));
                return;
            }
            state = State.STREAMING;
            pending.add(RelayEvent.start(handle.provider()));
        }

        private void pump() {
            var chunks = handle.chunks();
            try {
                if (!chunks.hasNext()) {
                    finish(State.DONE);
                    return;
                }
                var event = chunks.next();
                if (!event.isEmpty()) {
                    if (ProviderFailures.isHtml(event.delta())) {
                        metrics.blockedStreams().increment();
                        log.error("Provider {} returned HTML instead of text, stream abandoned", handle.provider());
                        pending.add(RelayEvent.error("Provider " + handle.provider()
                                + " returned HTML instead of text, probably blocked"));
                        finish(State.BLOCKED);
                        return;
                    }
                    buffer.append(event.delta());
                    pending.add(RelayEvent.chunk(event.delta(), handle.provider()));
                }
                if (event.done()) {
                    finish(State.DONE);
                }
            } catch (RuntimeException e) {
                log.error("Stream from {} broke after {} chars", handle.provider(), buffer.length(), e);
                pending.add(RelayEvent.error(ProviderFailures.describe(e)));
                finish(State.ERROR);
            }
        }

        private void finish(State terminal) {
            state = terminal;
            handle.close();
            var text = buffer.toString();
            if (text.isBlank()) {
                var substitute = fallback.respond(request.message());
                pending.add(RelayEvent.text(substitute, FALLBACK_PROVIDER));
                pending.add(RelayEvent.done(substitute, FALLBACK_PROVIDER, FALLBACK_MODEL, elapsedSeconds()));
                return;
            }
            pending.add(RelayEvent.done(text, handle.provider(), handle.model(), elapsedSeconds()));
        }

        private double elapsedSeconds() {
            return (System.nanoTime() - startNanos) / 1_000_000_000.0;
        }
    }
}
