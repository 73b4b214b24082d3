package com.chatrelay.gateway.http;

import com.chatrelay.fallback.FallbackResponder;
import com.chatrelay.observability.RelayMetrics;
import com.chatrelay.providers.ProviderCatalog;
import com.chatrelay.providers.ProviderRegistry;
import com.chatrelay.providers.StubProvider;
import com.chatrelay.providers.Tier;
import com.chatrelay.relay.Dispatcher;
import com.chatrelay.relay.ProviderProbe;
import com.chatrelay.relay.TimeoutPolicy;
import com.chatrelay.shared.config.TimeoutConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.hamcrest.Matchers.contains;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class StatusControllerTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        var catalog = ProviderCatalog.builder()
                .add(StubProvider.answering("You", "Test"), "gpt-4o-mini")
                .add(StubProvider.failing("Phind", "invalid token"), "phind")
                .add(StubProvider.answering("Llama3", "Test"), "llama-3")
                .build();
        var registry = ProviderRegistry.register(catalog, List.of("You", "Phind"),
                Map.of(Tier.PRIMARY, List.of("You"), Tier.SECONDARY, List.of("Phind")), "llama");
        var dispatcher = new Dispatcher(registry, "You", List.of(), new TimeoutPolicy(TimeoutConfig.defaults()),
                new FallbackResponder(), new RelayMetrics(), executor);
        var environment = new MockEnvironment()
                .withProperty("server.port", "5004")
                .withProperty("local.server.port", "6123");
        mvc = MockMvcBuilders.standaloneSetup(
                        new StatusController(registry, new ProviderProbe(registry, dispatcher), environment))
                .setControllerAdvice(new GatewayExceptionHandler())
                .build();
    }

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void healthListsRegistryByTier() throws Exception {
        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.port").value(6123))
                .andExpect(jsonPath("$.providers").value(3))
                .andExpect(jsonPath("$.tiers.primary", contains("Llama3", "You")))
                .andExpect(jsonPath("$.tiers.secondary", contains("Phind")))
                .andExpect(jsonPath("$.timestamp").isNumber());
    }

    @Test
    void probeReportsAvailableProvider() throws Exception {
        mvc.perform(get("/test-provider/You"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.requires_api_key").value(false))
                .andExpect(jsonPath("$.response").value("Test"));
    }

    @Test
    void probeFlagsCredentialProblems() throws Exception {
        mvc.perform(get("/test-provider/Phind"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.requires_api_key").value(true));
    }

    @Test
    void probeOfUnknownProviderIsStillOk() throws Exception {
        mvc.perform(get("/test-provider/Ghost"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("Provider Ghost not found"));
    }
}
