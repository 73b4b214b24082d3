package com.chatrelay.relay;

import java.util.List;

public class AllProvidersFailedException extends RuntimeException {

    private final String requestedProvider;
    private final List<String> failures;

    public AllProvidersFailedException(String requestedProvider, List<String> failures) {
        super("All providers failed (requested " + requestedProvider + "):\n" + String.join("\n", failures));
        this.requestedProvider = requestedProvider;
        this.failures = List.copyOf(failures);
    }

    public String requestedProvider() {
        return requestedProvider;
    }

    public List<String> failures() {
        return failures;
    }
}
