package com.chatrelay.gateway.http;

import com.chatrelay.providers.ProviderRegistry;
import com.chatrelay.providers.Tier;
import com.chatrelay.relay.ProviderProbe;
import org.springframework.core.env.Environment;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class StatusController {

    private final ProviderRegistry registry;
    private final ProviderProbe probe;
    private final Environment environment;

    public StatusController(ProviderRegistry registry, ProviderProbe probe, Environment environment) {
        this.registry = registry;
        this.probe = probe;
        this.environment = environment;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        var tiers = new LinkedHashMap<String, Object>();
        for (var tier : Tier.values()) {
            tiers.put(tier.key(), registry.namesIn(tier));
        }
        var body = new LinkedHashMap<String, Object>();
        body.put("status", "ok");
        body.put("service", "chat-relay");
        body.put("port", port());
        body.put("providers", registry.size());
        body.put("tiers", tiers);
        body.put("timestamp", Instant.now().toEpochMilli() / 1000.0);
        return body;
    }

    private int port() {
        var configured = environment.getProperty("server.port", Integer.class, 5004);
        return environment.getProperty("local.server.port", Integer.class, configured);
    }

    @GetMapping("/test-provider/{name}")
    public Map<String, Object> testProvider(@PathVariable("name") String name) {
        return probe.probe(name);
    }
}
