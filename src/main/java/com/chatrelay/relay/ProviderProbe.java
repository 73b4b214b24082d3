package com.chatrelay.relay;

import com.chatrelay.providers.ProviderException;
import com.chatrelay.providers.ProviderFailures;
import com.chatrelay.providers.ProviderRegistry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One-word availability check of a single provider. Diagnostic: failures are
 * reported with their raw text instead of being recovered.
 */
public class ProviderProbe {

    static final String PROMPT = "Say just one word: Test";
    static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final int MAX_PREVIEW = 100;

    private final ProviderRegistry registry;
    private final Dispatcher dispatcher;

    public ProviderProbe(ProviderRegistry registry, Dispatcher dispatcher) {
        this.registry = registry;
        this.dispatcher = dispatcher;
    }

    public Map<String, Object> probe(String name) {
        var result = new LinkedHashMap<String, Object>();
        if (!registry.contains(name)) {
            result.put("status", "error");
            result.put("message", "Provider " + name + " not found");
            return result;
        }
        try {
            var answer = dispatcher.direct(name, PROMPT, null, TIMEOUT);
            var text = answer.text() != null ? answer.text() : "";
            result.put("status", "ok");
            result.put("message", "Provider " + name + " is available");
            result.put("requires_api_key", false);
            result.put("response", text.length() > MAX_PREVIEW ? text.substring(0, MAX_PREVIEW) : text);
        } catch (ProviderException e) {
            result.put("status", "error");
            result.put("message", "Provider " + name + " check failed");
            result.put("error", ProviderFailures.describe(e));
            result.put("requires_api_key", ProviderFailures.requiresApiKey(e));
        }
        return result;
    }
}
