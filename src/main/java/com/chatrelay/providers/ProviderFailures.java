package com.chatrelay.providers;

import java.util.List;
import java.util.Locale;

/**
 * Text-sniffing classification of provider failures. Real backends report
 * blocks and credential problems as unstructured text, so these checks stay
 * as the compatibility path next to {@link ProviderException.Kind}.
 */
public final class ProviderFailures {

    private static final String HTML_MARKER = "<html";
    private static final List<String> CREDENTIAL_MARKERS = List.of("api_key", "apikey", "key", "token");

    private ProviderFailures() {}

    public static boolean isHtml(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(HTML_MARKER);
    }

    public static boolean requiresApiKey(Throwable error) {
        if (error instanceof ProviderException pe && pe.kind() == ProviderException.Kind.CREDENTIALS) {
            return true;
        }
        var msg = describe(error).toLowerCase(Locale.ROOT);
        return CREDENTIAL_MARKERS.stream().anyMatch(msg::contains);
    }

    public static ProviderException fromStatus(String provider, int status, String body) {
        var message = "LLM API error " + status + ": " + body;
        if (status == 401 || status == 403) {
            return new ProviderException(provider, ProviderException.Kind.CREDENTIALS, message);
        }
        if (isHtml(body)) {
            return new ProviderException(provider, ProviderException.Kind.BLOCKED, message);
        }
        return new ProviderException(provider, ProviderException.Kind.UPSTREAM, message);
    }

    public static ProviderException blocked(String provider) {
        return new ProviderException(provider, ProviderException.Kind.BLOCKED,
                "Provider " + provider + " returned HTML instead of text, probably blocked");
    }

    public static String describe(Throwable t) {
        var root = t;
        while (root.getCause() != null && root.getCause() != root) root = root.getCause();
        var msg = root.getMessage();
        if (msg == null || msg.isBlank()) msg = t.getMessage();
        return msg != null ? msg : t.getClass().getSimpleName();
    }
}
