package com.chatrelay.relay;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One server-sent-event frame: the event name and its JSON payload.
 */
public record RelayEvent(String type, Map<String, Object> payload) {

    public static final String START = "start";
    public static final String CHUNK = "chunk";
    public static final String ERROR = "error";
    public static final String TEXT = "text";
    public static final String DONE = "done";

    static RelayEvent start(String provider) {
        return of(START, "status", "start", "provider", provider);
    }

    static RelayEvent chunk(String chunk, String provider) {
        return of(CHUNK, "chunk", chunk, "provider", provider);
    }

    static RelayEvent error(String message) {
        return of(ERROR, "error", message);
    }

    static RelayEvent text(String text, String provider) {
        return of(TEXT, "text", text, "provider", provider);
    }

    static RelayEvent done(String fullText, String provider, String model, double elapsedSeconds) {
        return of(DONE, "status", "done", "full_text", fullText, "provider", provider,
                "model", model, "elapsed", elapsedSeconds);
    }

    private static RelayEvent of(String type, Object... keyValues) {
        var payload = new LinkedHashMap<String, Object>();
        for (int i = 0; i < keyValues.length; i += 2) {
            payload.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new RelayEvent(type, Collections.unmodifiableMap(payload));
    }
}
