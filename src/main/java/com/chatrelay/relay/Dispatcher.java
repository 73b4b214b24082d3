package com.chatrelay.relay;

import com.chatrelay.fallback.FallbackResponder;
import com.chatrelay.observability.RelayMetrics;
import com.chatrelay.providers.ChatEvent;
import com.chatrelay.providers.ChatRequest;
import com.chatrelay.providers.ChatResponse;
import com.chatrelay.providers.ProviderDescriptor;
import com.chatrelay.providers.ProviderException;
import com.chatrelay.providers.ProviderFailures;
import com.chatrelay.providers.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sends a prompt to the preferred provider and walks the backup list once, in
 * order, when it fails. Chat calls never end in a hard error: exhaustion is
 * reported as a soft failure carrying canned text.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final ProviderRegistry registry;
    private final String defaultProvider;
    private final List<String> backups;
    private final TimeoutPolicy timeouts;
    private final FallbackResponder fallback;
    private final RelayMetrics metrics;
    private final ExecutorService executor;

    public Dispatcher(ProviderRegistry registry, String defaultProvider, List<String> backups,
                      TimeoutPolicy timeouts, FallbackResponder fallback, RelayMetrics metrics,
                      ExecutorService executor) {
        this.registry = registry;
        this.defaultProvider = defaultProvider;
        this.backups = List.copyOf(backups);
        this.timeouts = timeouts;
        this.fallback = fallback;
        this.metrics = metrics;
        this.executor = executor;
    }

    public DispatchResult dispatch(DispatchRequest request) {
        long start = System.nanoTime();
        var requested = requestedName(request);
        var attempts = attemptOrder(request.preferredProvider());
        var failures = new ArrayList<String>();

        for (int i = 0; i < attempts.size(); i++) {
            var descriptor = attempts.get(i);
            var timeout = timeouts.effective(descriptor.name(), request.timeout());
            try {
                var response = complete(descriptor, request.message(), timeout);
                metrics.providerCall(descriptor.name(), true);
                if (i > 0) {
                    metrics.failovers().increment();
                    log.info("Recovered via backup provider={} model={}", descriptor.name(), descriptor.model());
                }
                var elapsed = since(start);
                metrics.dispatchLatency(elapsed);
                return DispatchResult.ok(response.content(), descriptor.name(), descriptor.model(), elapsed);
            } catch (ProviderException e) {
                metrics.providerCall(descriptor.name(), false);
                failures.add(descriptor.name() + ": " + e.getMessage());
                log.warn("Provider {} failed [{}]: {}", descriptor.name(), e.kind(), e.getMessage());
            }
        }

        metrics.exhausted().increment();
        log.warn("All providers failed for {}, answering with fallback text", requested);
        var text = fallback.match(request.message())
                .orElseGet(() -> fallback.apology(request.message(), requested));
        var elapsed = since(start);
        metrics.dispatchLatency(elapsed);
        return DispatchResult.softFailure(text, requested, elapsed,
                failures.isEmpty() ? "No providers registered" : String.join("; ", failures));
    }

    /**
     * Streaming counterpart of {@link #dispatch}: an attempt fails when the
     * capability throws, produces nothing within its timeout, or opens with an
     * HTML page.
     */
    public StreamHandle openStream(DispatchRequest request) {
        var requested = requestedName(request);
        var failures = new ArrayList<String>();
        var attempts = attemptOrder(request.preferredProvider());

        for (int i = 0; i < attempts.size(); i++) {
            var descriptor = attempts.get(i);
            var timeout = timeouts.effective(descriptor.name(), request.timeout());
            var chatRequest = ChatRequest.user(descriptor.model(), request.message(), timeout);
            var opened = new AtomicReference<Iterator<ChatEvent>>();
            try {
                var first = invoke(descriptor.name(), timeout, () -> {
                    var stream = descriptor.capability().chatStream(chatRequest);
                    opened.set(stream);
                    return peekFirst(descriptor.name(), stream);
                });
                metrics.providerCall(descriptor.name(), true);
                if (i > 0) {
                    metrics.failovers().increment();
                    log.info("Streaming via backup provider={} model={}", descriptor.name(), descriptor.model());
                }
                return new StreamHandle(descriptor.name(), descriptor.model(),
                        new TimedChunks(descriptor.name(), timeout, first, opened.get()));
            } catch (ProviderException e) {
                release(descriptor.name(), opened.get());
                metrics.providerCall(descriptor.name(), false);
                failures.add(descriptor.name() + ": " + e.getMessage());
                log.warn("Provider {} failed to stream [{}]: {}", descriptor.name(), e.kind(), e.getMessage());
            }
        }
        metrics.exhausted().increment();
        throw new AllProvidersFailedException(requested,
                failures.isEmpty() ? List.of("No providers registered") : failures);
    }

    /** Exactly one call to the named provider, without failover. */
    public DispatchResult direct(String provider, String message, String model, Duration timeout) {
        var descriptor = registry.get(provider).orElseThrow(() -> new UnknownProviderException(provider));
        var effectiveModel = model != null && !model.isBlank() ? model : descriptor.model();
        var bounded = timeouts.clamp(timeout);
        long start = System.nanoTime();

        var chatRequest = ChatRequest.user(effectiveModel, message, bounded);
        ChatResponse response;
        try {
            response = invoke(provider, bounded, () -> descriptor.capability().chat(chatRequest));
        } catch (ProviderException e) {
            metrics.providerCall(provider, false);
            throw e;
        }
        if (response == null || !response.hasContent()) {
            metrics.providerCall(provider, false);
            throw new ProviderException(provider, ProviderException.Kind.EMPTY,
                    "Provider " + provider + " returned an empty answer");
        }
        if (ProviderFailures.isHtml(response.content())) {
            metrics.providerCall(provider, false);
            throw ProviderFailures.blocked(provider);
        }
        metrics.providerCall(provider, true);
        var elapsed = since(start);
        log.info("Provider {} answered in {} ms", provider, elapsed.toMillis());
        return DispatchResult.ok(response.content(), provider, effectiveModel, elapsed);
    }

    /** The provider name a caller asked for, or the default when none was given. */
    public String requestedName(DispatchRequest request) {
        return request.preferredProvider() != null ? request.preferredProvider() : defaultProvider;
    }

    List<ProviderDescriptor> attemptOrder(String preferred) {
        var order = new ArrayList<ProviderDescriptor>();
        var seen = new HashSet<String>();

        var initial = registry.get(preferred)
                .or(() -> registry.get(defaultProvider))
                .or(() -> registry.ordered().stream().findFirst());
        if (preferred != null && !registry.contains(preferred)) {
            log.warn("Requested provider {} is not registered, starting with {}",
                    preferred, initial.map(ProviderDescriptor::name).orElse("nothing"));
        }
        initial.ifPresent(d -> {
            order.add(d);
            seen.add(d.name());
        });

        for (var name : backups) {
            if (seen.contains(name)) continue;
            var backup = registry.get(name);
            if (backup.isEmpty()) {
                log.debug("Backup provider {} is not registered, skipped", name);
                continue;
            }
            order.add(backup.get());
            seen.add(name);
        }
        return order;
    }

    private ChatResponse complete(ProviderDescriptor descriptor, String message, Duration timeout) {
        var chatRequest = ChatRequest.user(descriptor.model(), message, timeout);
        var response = invoke(descriptor.name(), timeout, () -> descriptor.capability().chat(chatRequest));
        if (response == null || !response.hasContent()) {
            throw new ProviderException(descriptor.name(), ProviderException.Kind.EMPTY,
                    "Provider " + descriptor.name() + " returned an empty answer");
        }
        if (ProviderFailures.isHtml(response.content())) {
            throw ProviderFailures.blocked(descriptor.name());
        }
        return response;
    }

    private <T> T invoke(String provider, Duration timeout, Callable<T> call) {
        Future<T> future = executor.submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderException(provider, ProviderException.Kind.TIMEOUT,
                    "Provider " + provider + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof ProviderException pe) throw pe;
            throw new ProviderException(provider, ProviderException.Kind.UPSTREAM,
                    ProviderFailures.describe(cause), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderException(provider, ProviderException.Kind.TIMEOUT,
                    "Interrupted waiting for " + provider, e);
        }
    }

    private static ChatEvent peekFirst(String provider, Iterator<ChatEvent> stream) {
        if (stream == null) {
            throw new ProviderException(provider, ProviderException.Kind.EMPTY, "Provider " + provider + " returned no stream");
        }
        while (stream.hasNext()) {
            var event = stream.next();
            if (event.isEmpty() && !event.done()) continue;
            if (event.isEmpty()) break;
            if (ProviderFailures.isHtml(event.delta())) {
                throw ProviderFailures.blocked(provider);
            }
            return event;
        }
        throw new ProviderException(provider, ProviderException.Kind.EMPTY,
                "Provider " + provider + " streamed no content");
    }

    /** Closes an upstream chunk source if it holds a connection. */
    static void release(String provider, Object chunks) {
        if (!(chunks instanceof AutoCloseable closeable)) return;
        try {
            closeable.close();
        } catch (Exception e) {
            log.warn("Could not close stream from {}: {}", provider, e.getMessage());
        }
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Yields the already checked first chunk, then reads the rest of the
     * upstream iterator on the provider executor, one bounded wait per chunk.
     * A read that times out or fails closes the upstream source.
     */
    private final class TimedChunks implements Iterator<ChatEvent>, AutoCloseable {
        private final String provider;
        private final Duration timeout;
        private final Iterator<ChatEvent> source;
        private ChatEvent head;
        private boolean finished;

        TimedChunks(String provider, Duration timeout, ChatEvent head, Iterator<ChatEvent> source) {
            this.provider = provider;
            this.timeout = timeout;
            this.head = head;
            this.source = source;
        }

        @Override
        public boolean hasNext() {
            if (head != null) return true;
            if (finished) return false;
            try {
                head = invoke(provider, timeout, () -> source.hasNext() ? source.next() : null);
            } catch (ProviderException e) {
                close();
                throw e;
            }
            if (head == null) {
                close();
                return false;
            }
            return true;
        }

        @Override
        public ChatEvent next() {
            if (!hasNext()) throw new NoSuchElementException();
            var event = head;
            head = null;
            return event;
        }

        @Override
        public void close() {
            if (finished) return;
            finished = true;
            release(provider, source);
        }
    }
}
