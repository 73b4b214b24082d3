package com.chatrelay.providers;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProviderFailuresTest {

    @Test
    void detectsHtmlInAnyCase() {
        assertTrue(ProviderFailures.isHtml("<!DOCTYPE html><HTML><body>blocked</body>"));
        assertTrue(ProviderFailures.isHtml("  <html lang=\"en\">"));
        assertFalse(ProviderFailures.isHtml("use the html tag"));
        assertFalse(ProviderFailures.isHtml(null));
    }

    @Test
    void credentialHintsFromText() {
        assertTrue(ProviderFailures.requiresApiKey(new RuntimeException("Missing api_key")));
        assertTrue(ProviderFailures.requiresApiKey(new RuntimeException("Invalid TOKEN supplied")));
        assertFalse(ProviderFailures.requiresApiKey(new RuntimeException("Connection reset")));
    }

    @Test
    void credentialHintsFromKind() {
        var e = ProviderFailures.fromStatus("p", 401, "Unauthorized");
        assertEquals(ProviderException.Kind.CREDENTIALS, e.kind());
        assertTrue(ProviderFailures.requiresApiKey(e));
    }

    @Test
    void classifiesStatusBodies() {
        assertEquals(ProviderException.Kind.BLOCKED,
                ProviderFailures.fromStatus("p", 503, "<html>cloudflare</html>").kind());
        assertEquals(ProviderException.Kind.UPSTREAM,
                ProviderFailures.fromStatus("p", 500, "boom").kind());
    }

    @Test
    void describeUsesRootCause() {
        var e = new RuntimeException("outer", new IllegalStateException("inner cause"));
        assertEquals("inner cause", ProviderFailures.describe(e));
    }
}
