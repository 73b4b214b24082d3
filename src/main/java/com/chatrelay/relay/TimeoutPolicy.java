package com.chatrelay.relay;

import com.chatrelay.shared.config.TimeoutConfig;

import java.time.Duration;

/**
 * Caller timeouts are clamped to [1s, max]; large backends get a floor that
 * overrides a shorter caller timeout.
 */
public class TimeoutPolicy {

    private static final Duration MIN = Duration.ofSeconds(1);

    private final Duration defaultTimeout;
    private final Duration max;
    private final TimeoutConfig config;

    public TimeoutPolicy(TimeoutConfig config) {
        this.config = config;
        this.defaultTimeout = Duration.ofSeconds(config.defaultSeconds());
        this.max = Duration.ofSeconds(config.maxSeconds());
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    public Duration clamp(Duration timeout) {
        if (timeout == null) return defaultTimeout;
        if (timeout.compareTo(MIN) < 0) return MIN;
        if (timeout.compareTo(max) > 0) return max;
        return timeout;
    }

    public Duration effective(String provider, Duration callerTimeout) {
        var clamped = clamp(callerTimeout);
        var floor = config.floors().get(provider);
        if (floor == null) return clamped;
        var floorDuration = Duration.ofSeconds(floor);
        return floorDuration.compareTo(clamped) > 0 ? floorDuration : clamped;
    }

    /** Seconds from a request body; absent means the default. */
    public Duration fromSeconds(Number seconds) {
        if (seconds == null) return defaultTimeout;
        return clamp(Duration.ofMillis(Math.round(seconds.doubleValue() * 1000)));
    }

    /** Stream timeouts arrive in milliseconds; anything outside (0, max] means the default. */
    public Duration fromStreamMillis(Number millis) {
        if (millis == null) return defaultTimeout;
        var value = millis.doubleValue();
        if (!(value > 0) || value > max.toMillis()) return defaultTimeout;
        return Duration.ofMillis(Math.round(value));
    }
}
