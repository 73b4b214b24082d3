package com.chatrelay.gateway;

import com.chatrelay.convert.RasterToSvgConverter;
import com.chatrelay.fallback.FallbackResponder;
import com.chatrelay.observability.RelayMetrics;
import com.chatrelay.providers.ProviderCatalog;
import com.chatrelay.providers.ProviderRegistry;
import com.chatrelay.providers.Tier;
import com.chatrelay.relay.Dispatcher;
import com.chatrelay.relay.ProviderProbe;
import com.chatrelay.relay.StreamRelay;
import com.chatrelay.relay.TimeoutPolicy;
import com.chatrelay.shared.config.ConfigLoader;
import com.chatrelay.shared.config.RelayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Startup wiring. The registry is built once here and handed to everything
 * that needs it; nothing mutates it afterwards.
 */
@Configuration
public class RelayBeans {

    private static final Logger log = LoggerFactory.getLogger(RelayBeans.class);

    @Bean
    public RelayConfig relayConfig() {
        return ConfigLoader.load();
    }

    @Bean
    public RelayMetrics relayMetrics() {
        return new RelayMetrics();
    }

    @Bean
    public FallbackResponder fallbackResponder() {
        return new FallbackResponder();
    }

    @Bean
    public ProviderRegistry providerRegistry(RelayConfig config) {
        var catalog = ProviderCatalog.fromConfig(config.backends());
        if (catalog.names().isEmpty()) {
            log.warn("No backends configured. Add a backends section to ~/.chatrelay/config.yaml");
        }
        return ProviderRegistry.register(catalog, config.candidates(), tierGroups(config.tierGroups()),
                config.promotePattern());
    }

    @Bean
    public TimeoutPolicy timeoutPolicy(RelayConfig config) {
        return new TimeoutPolicy(config.timeouts());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService providerExecutor() {
        return Executors.newCachedThreadPool(named("provider-call"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService relayExecutor() {
        return Executors.newCachedThreadPool(named("sse-relay"));
    }

    @Bean
    public Dispatcher dispatcher(ProviderRegistry registry, RelayConfig config, TimeoutPolicy timeouts,
                                 FallbackResponder fallback, RelayMetrics metrics,
                                 @Qualifier("providerExecutor") ExecutorService providerExecutor) {
        return new Dispatcher(registry, config.defaultProvider(), config.backupProviders(),
                timeouts, fallback, metrics, providerExecutor);
    }

    @Bean
    public StreamRelay streamRelay(Dispatcher dispatcher, FallbackResponder fallback, RelayMetrics metrics) {
        return new StreamRelay(dispatcher, fallback, metrics);
    }

    @Bean
    public ProviderProbe providerProbe(ProviderRegistry registry, Dispatcher dispatcher) {
        return new ProviderProbe(registry, dispatcher);
    }

    @Bean
    public RasterToSvgConverter rasterToSvgConverter() {
        return new RasterToSvgConverter();
    }

    static Map<Tier, List<String>> tierGroups(Map<String, List<String>> raw) {
        var groups = new EnumMap<Tier, List<String>>(Tier.class);
        for (var tier : Tier.values()) {
            groups.put(tier, raw.getOrDefault(tier.key(), List.of()));
        }
        return groups;
    }

    private static ThreadFactory named(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            var t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
