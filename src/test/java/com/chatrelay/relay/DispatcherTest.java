package com.chatrelay.relay;

import com.chatrelay.fallback.FallbackResponder;
import com.chatrelay.observability.RelayMetrics;
import com.chatrelay.providers.ChatEvent;
import com.chatrelay.providers.ModelProvider;
import com.chatrelay.providers.ProviderCatalog;
import com.chatrelay.providers.ProviderException;
import com.chatrelay.providers.ProviderRegistry;
import com.chatrelay.providers.StubProvider;
import com.chatrelay.providers.TrackedChunks;
import com.chatrelay.shared.config.TimeoutConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class DispatcherTest {

    static final String LARGE = "Qwen_Qwen_2_72B";
    static final List<String> BACKUPS = List.of(LARGE, "Qwen_Qwen_2_5_Max", "Qwen_Qwen_2_5", "Qwen_Qwen_2_5M");

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final RelayMetrics metrics = new RelayMetrics();

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    static ProviderRegistry registry(ModelProvider... providers) {
        var catalog = ProviderCatalog.builder();
        var names = new ArrayList<String>();
        for (var p : providers) {
            catalog.add(p, "model-" + p.id());
            names.add(p.id());
        }
        return ProviderRegistry.register(catalog.build(), names, Map.of(), null);
    }

    private Dispatcher dispatcher(ModelProvider... providers) {
        return new Dispatcher(registry(providers), LARGE, BACKUPS,
                new TimeoutPolicy(TimeoutConfig.defaults()),
                new FallbackResponder(new Random(7)), metrics, executor);
    }

    private static DispatchRequest ask(String message, String provider, int timeoutSeconds) {
        return DispatchRequest.of(message, provider, Duration.ofSeconds(timeoutSeconds));
    }

    @Test
    void answersFromPreferredProvider() {
        var you = StubProvider.answering("You", "hello from You");
        var large = StubProvider.answering(LARGE, "hello from large");

        var result = dispatcher(you, large).dispatch(ask("hi", "You", 10));

        assertTrue(result.success());
        assertEquals("hello from You", result.text());
        assertEquals("You", result.providerUsed());
        assertEquals("model-You", result.model());
        assertEquals(0, large.calls());
    }

    @Test
    void failsOverInBackupOrderAndStopsAtFirstSuccess() {
        var you = StubProvider.failing("You", "502 bad gateway");
        var large = StubProvider.failing(LARGE, "connection reset");
        var max = StubProvider.answering("Qwen_Qwen_2_5_Max", "from max");
        var plain = StubProvider.answering("Qwen_Qwen_2_5", "from 2.5");

        var result = dispatcher(you, large, max, plain).dispatch(ask("question", "You", 10));

        assertEquals("from max", result.text());
        assertEquals("Qwen_Qwen_2_5_Max", result.providerUsed());
        assertFalse(result.isFallback());
        assertEquals(1, you.calls());
        assertEquals(1, large.calls());
        assertEquals(0, plain.calls());
        assertEquals(1.0, metrics.failovers().count());
    }

    @Test
    void failedPreferredBackupIsNotRetried() {
        var max = StubProvider.failing("Qwen_Qwen_2_5_Max", "down");
        var large = StubProvider.answering(LARGE, "large answer");

        var result = dispatcher(max, large).dispatch(ask("question", "Qwen_Qwen_2_5_Max", 10));

        assertEquals(LARGE, result.providerUsed());
        assertEquals(1, max.calls());
    }

    @Test
    void unregisteredPreferredFallsBackToDefault() {
        var large = StubProvider.answering(LARGE, "default answer");

        var result = dispatcher(large).dispatch(ask("question", "NoSuchProvider", 10));

        assertTrue(result.success());
        assertEquals(LARGE, result.providerUsed());
        assertNotEquals("NoSuchProvider", result.providerUsed());
    }

    @Test
    void exhaustionWithGreetingReturnsGreetingFallback() {
        var result = dispatcher().dispatch(ask("привет", null, 10));

        assertTrue(result.success());
        assertEquals(FallbackResponder.GREETING, result.text());
        assertEquals(LARGE + "_fallback", result.providerUsed());
        assertEquals("fallback", result.model());
        assertEquals(1.0, metrics.exhausted().count());
    }

    @Test
    void exhaustionReportsRequestedProviderWithSuffix() {
        var you = StubProvider.failing("You", "boom");
        var large = StubProvider.failing(LARGE, "boom");

        var result = dispatcher(you, large).dispatch(ask("Explain monads", "You", 10));

        assertTrue(result.success());
        assertEquals("You_fallback", result.providerUsed());
        assertTrue(result.text().contains("You"));
        assertTrue(result.text().startsWith("Sorry"));
        assertNotNull(result.error());
        assertEquals(1, you.calls());
        assertEquals(1, large.calls());
    }

    @Test
    void apologyFollowsCallersLanguage() {
        var result = dispatcher().dispatch(ask("Объясни монады", "You", 10));
        assertTrue(result.text().startsWith("Извините"));
        assertEquals("You_fallback", result.providerUsed());
    }

    @Test
    void largeModelFloorOverridesShortCallerTimeout() {
        // Succeeds only if the call is allowed at least 40s.
        var large = StubProvider.of(LARGE, r -> {
            if (r.timeout().compareTo(Duration.ofSeconds(40)) < 0) {
                throw new RuntimeException("timed out after " + r.timeout().toSeconds() + "s");
            }
            return "slow but fine";
        });

        var result = dispatcher(large).dispatch(ask("think hard", LARGE, 5));

        assertEquals(LARGE, result.providerUsed());
        assertEquals(Duration.ofSeconds(45), large.lastRequest().timeout());
    }

    @Test
    void providersWithoutFloorKeepCallerTimeout() {
        var you = StubProvider.answering("You", "ok");
        dispatcher(you).dispatch(ask("q", "You", 5));
        assertEquals(Duration.ofSeconds(5), you.lastRequest().timeout());
    }

    @Test
    void slowProviderIsAbandonedAtItsTimeout() {
        var slow = StubProvider.of("You", r -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "too late";
        });
        var large = StubProvider.answering(LARGE, "on time");

        long start = System.nanoTime();
        var result = dispatcher(slow, large).dispatch(ask("q", "You", 1));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals(LARGE, result.providerUsed());
        assertTrue(elapsedMs < 4_000, "took " + elapsedMs + "ms");
    }

    @Test
    void blankAndHtmlAnswersCountAsFailures() {
        var you = StubProvider.answering("You", "   ");
        var large = StubProvider.answering(LARGE, "<html><body>Just a moment...</body></html>");
        var max = StubProvider.answering("Qwen_Qwen_2_5_Max", "real text");

        var result = dispatcher(you, large, max).dispatch(ask("q", "You", 10));

        assertEquals("Qwen_Qwen_2_5_Max", result.providerUsed());
        assertEquals("real text", result.text());
    }

    @Test
    void directCallsOnlyTheNamedProvider() {
        var you = StubProvider.failing("You", "upstream 500");
        var large = StubProvider.answering(LARGE, "unused");
        var dispatcher = dispatcher(you, large);

        var ex = assertThrows(ProviderException.class,
                () -> dispatcher.direct("You", "q", null, Duration.ofSeconds(5)));
        assertTrue(ex.getMessage().contains("upstream 500"));
        assertEquals(0, large.calls());
    }

    @Test
    void directUsesRequestedModel() {
        var you = StubProvider.of("You", r -> "model was " + r.model());

        var result = dispatcher(you).direct("You", "q", "gpt-4o", Duration.ofSeconds(5));

        assertEquals("model was gpt-4o", result.text());
        assertEquals("gpt-4o", result.model());
    }

    @Test
    void directRejectsBlankAnswer() {
        var you = StubProvider.answering("You", "  ");
        var dispatcher = dispatcher(you);

        var ex = assertThrows(ProviderException.class,
                () -> dispatcher.direct("You", "q", null, Duration.ofSeconds(2)));
        assertEquals(ProviderException.Kind.EMPTY, ex.kind());
    }

    @Test
    void directRejectsMissingAnswer() {
        var you = new StubProvider("You", r -> null, r -> List.<ChatEvent>of().iterator());
        var dispatcher = dispatcher(you);

        var ex = assertThrows(ProviderException.class,
                () -> dispatcher.direct("You", "q", null, Duration.ofSeconds(2)));
        assertEquals(ProviderException.Kind.EMPTY, ex.kind());
    }

    @Test
    void directToUnknownProviderMakesNoCall() {
        var large = StubProvider.answering(LARGE, "unused");
        var dispatcher = dispatcher(large);

        assertThrows(UnknownProviderException.class,
                () -> dispatcher.direct("Nope", "q", null, Duration.ofSeconds(5)));
        assertEquals(0, large.calls());
    }

    @Test
    void openStreamSkipsProviderWhoseFirstChunkIsHtml() {
        var you = StubProvider.streaming("You", "<html>blocked</html>", "never");
        var large = StubProvider.streaming(LARGE, "Hel", "lo");

        var handle = dispatcher(you, large).openStream(DispatchRequest.of("hi", "You", Duration.ofSeconds(5)));

        assertEquals(LARGE, handle.provider());
        var chunks = new ArrayList<String>();
        handle.chunks().forEachRemaining(e -> chunks.add(e.delta()));
        assertEquals(List.of("Hel", "lo"), chunks);
    }

    @Test
    void rejectedStreamIsClosed() {
        var blocked = TrackedChunks.of("<html>blocked</html>");
        var you = new StubProvider("You", r -> "", r -> blocked);
        var large = StubProvider.streaming(LARGE, "ok");

        var handle = dispatcher(you, large).openStream(DispatchRequest.of("hi", "You", Duration.ofSeconds(5)));

        assertEquals(LARGE, handle.provider());
        assertTrue(blocked.closed());
    }

    @Test
    void openStreamThrowsWhenEveryProviderFails() {
        var you = StubProvider.failing("You", "down");
        var empty = new StubProvider(LARGE, r -> "", r -> List.<ChatEvent>of().iterator());

        var ex = assertThrows(AllProvidersFailedException.class,
                () -> dispatcher(you, empty).openStream(DispatchRequest.of("hi", "You", Duration.ofSeconds(5))));
        assertEquals("You", ex.requestedProvider());
        assertEquals(2, ex.failures().size());
    }

    @Test
    void rejectsBlankMessage() {
        assertThrows(IllegalArgumentException.class, () -> ask("  ", null, 5));
    }
}
