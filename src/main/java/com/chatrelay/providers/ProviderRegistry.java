package com.chatrelay.providers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Name to descriptor mapping built once at startup and read-only afterwards.
 * Candidates that the catalog cannot resolve are logged and dropped; backends
 * whose name matches the promote pattern join the primary tier ahead of the
 * configured primaries.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderDescriptor> descriptors;
    private final Set<String> promoted;

    private ProviderRegistry(Map<String, ProviderDescriptor> descriptors, Set<String> promoted) {
        this.descriptors = Collections.unmodifiableMap(descriptors);
        this.promoted = Collections.unmodifiableSet(promoted);
    }

    public static ProviderRegistry register(ProviderCatalog catalog, List<String> candidates,
                                            Map<Tier, List<String>> tierGroups, String promotePattern) {
        var descriptors = new LinkedHashMap<String, ProviderDescriptor>();
        var promoted = new LinkedHashSet<String>();

        for (var name : candidates) {
            if (descriptors.containsKey(name)) continue;
            var capability = catalog.resolve(name);
            if (capability.isPresent()) {
                descriptors.put(name, new ProviderDescriptor(
                        name, capability.get(), catalog.modelFor(name), tierOf(name, tierGroups)));
                log.info("Loaded provider: {}", name);
            } else {
                log.warn("Provider {} not found, skipped", name);
            }
        }

        if (promotePattern != null && !promotePattern.isBlank()) {
            var needle = promotePattern.toLowerCase(Locale.ROOT);
            for (var name : catalog.names()) {
                if (!name.toLowerCase(Locale.ROOT).contains(needle)) continue;
                var capability = catalog.resolve(name).orElseThrow();
                descriptors.put(name, new ProviderDescriptor(name, capability, catalog.modelFor(name), Tier.PRIMARY));
                promoted.add(name);
                log.info("Loaded promoted provider: {} (matches '{}')", name, promotePattern);
            }
        }

        log.info("Provider registry ready: {} providers, {} promoted", descriptors.size(), promoted.size());
        return new ProviderRegistry(descriptors, promoted);
    }

    private static Tier tierOf(String name, Map<Tier, List<String>> tierGroups) {
        for (var tier : Tier.values()) {
            if (tierGroups.getOrDefault(tier, List.of()).contains(name)) return tier;
        }
        return Tier.FALLBACK;
    }

    public Optional<ProviderDescriptor> get(String name) {
        return Optional.ofNullable(name).map(descriptors::get);
    }

    public boolean contains(String name) {
        return name != null && descriptors.containsKey(name);
    }

    public int size() {
        return descriptors.size();
    }

    public Set<String> names() {
        return descriptors.keySet();
    }

    public boolean isPromoted(String name) {
        return promoted.contains(name);
    }

    /** Descriptors by tier; promoted names lead the primary tier. */
    public List<ProviderDescriptor> ordered() {
        var list = new ArrayList<>(descriptors.values());
        list.sort(Comparator.comparing(ProviderDescriptor::tier)
                .thenComparing(d -> promoted.contains(d.name()) ? 0 : 1));
        return List.copyOf(list);
    }

    public List<String> namesIn(Tier tier) {
        return ordered().stream()
                .filter(d -> d.tier() == tier)
                .map(ProviderDescriptor::name)
                .toList();
    }
}
