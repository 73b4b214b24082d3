package com.chatrelay.providers;

import com.chatrelay.shared.config.BackendConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The universe of backend names this process knows how to reach, and the
 * model each one is asked for.
 */
public class ProviderCatalog {

    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    private final Map<String, ModelProvider> providers;
    private final Map<String, String> models;

    private ProviderCatalog(Map<String, ModelProvider> providers, Map<String, String> models) {
        this.providers = Collections.unmodifiableMap(new LinkedHashMap<>(providers));
        this.models = Map.copyOf(models);
    }

    public static ProviderCatalog fromConfig(Map<String, BackendConfig> backends) {
        var builder = builder();
        backends.forEach((name, backend) -> builder.add(
                new OpenAiCompatibleProvider(name, backend.apiKey(), backend.baseUrl(), backend.model()),
                backend.model()));
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> names() {
        return providers.keySet();
    }

    public Optional<ModelProvider> resolve(String name) {
        return Optional.ofNullable(name).map(providers::get);
    }

    public String modelFor(String name) {
        return models.getOrDefault(name, DEFAULT_MODEL);
    }

    public static class Builder {
        private final Map<String, ModelProvider> providers = new LinkedHashMap<>();
        private final Map<String, String> models = new LinkedHashMap<>();

        public Builder add(ModelProvider provider, String model) {
            providers.put(provider.id(), provider);
            if (model != null && !model.isBlank()) {
                models.put(provider.id(), model);
            }
            return this;
        }

        public ProviderCatalog build() {
            return new ProviderCatalog(providers, models);
        }
    }
}
