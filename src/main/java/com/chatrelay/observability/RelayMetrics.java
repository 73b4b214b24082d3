package com.chatrelay.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

public class RelayMetrics {

    private final MeterRegistry registry;

    public RelayMetrics() {
        this(new SimpleMeterRegistry());
    }

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public void providerCall(String provider, boolean success) {
        Counter.builder("chatrelay.provider.calls")
                .tag("provider", provider)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public Counter failovers() {
        return Counter.builder("chatrelay.failovers").register(registry);
    }

    public Counter exhausted() {
        return Counter.builder("chatrelay.exhausted").register(registry);
    }

    public Counter blockedStreams() {
        return Counter.builder("chatrelay.stream.blocked").register(registry);
    }

    public void dispatchLatency(Duration elapsed) {
        Timer.builder("chatrelay.dispatch.latency").register(registry).record(elapsed);
    }
}
