package com.chatrelay.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".chatrelay", "config.yaml"
    );
    private static final Pattern ENV_REF = Pattern.compile("^\\$\\{([A-Za-z_][A-Za-z0-9_]*)}$");

    public static RelayConfig load() {
        var override = System.getenv("CHATRELAY_CONFIG");
        return load(override != null && !override.isBlank() ? Path.of(override) : DEFAULT_PATH);
    }

    public static RelayConfig load(Path path) {
        return load(path, System::getenv);
    }

    @SuppressWarnings("unchecked")
    static RelayConfig load(Path path, UnaryOperator<String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = (Map<String, Object>) raw.getOrDefault("server", Map.of());
        var providers = (Map<String, Object>) raw.getOrDefault("providers", Map.of());
        var timeouts = (Map<String, Object>) raw.getOrDefault("timeouts", Map.of());
        var backends = (Map<String, Map<String, Object>>) raw.getOrDefault("backends", Map.of());

        return new RelayConfig(
            Integer.parseInt(envOrDefault(env, "CHATRELAY_PORT",
                String.valueOf(server.getOrDefault("port", 5004)))),
            envOrDefault(env, "CHATRELAY_DEFAULT_PROVIDER",
                String.valueOf(providers.getOrDefault("default", "Qwen_Qwen_2_72B"))),
            stringList(providers.getOrDefault("candidates", RelayConfig.DEFAULT_CANDIDATES)),
            stringList(providers.getOrDefault("backup", RelayConfig.DEFAULT_BACKUPS)),
            String.valueOf(providers.getOrDefault("promote-pattern", "llama")),
            parseTiers((Map<String, Object>) providers.get("tiers")),
            parseTimeouts(timeouts),
            parseBackends(backends, env)
        );
    }

    private static Map<String, List<String>> parseTiers(Map<String, Object> tiers) {
        if (tiers == null) return RelayConfig.DEFAULT_TIERS;
        var result = new LinkedHashMap<String, List<String>>();
        tiers.forEach((k, v) -> result.put(k, stringList(v)));
        return Map.copyOf(result);
    }

    @SuppressWarnings("unchecked")
    private static TimeoutConfig parseTimeouts(Map<String, Object> timeouts) {
        var defaults = TimeoutConfig.defaults();
        var floors = timeouts.containsKey("floors")
                ? new HashMap<String, Integer>()
                : new HashMap<>(defaults.floors());
        var rawFloors = (Map<String, Object>) timeouts.getOrDefault("floors", Map.of());
        rawFloors.forEach((k, v) -> floors.put(k, Integer.parseInt(String.valueOf(v))));
        return new TimeoutConfig(
            Integer.parseInt(String.valueOf(timeouts.getOrDefault("default", defaults.defaultSeconds()))),
            Integer.parseInt(String.valueOf(timeouts.getOrDefault("max", defaults.maxSeconds()))),
            Map.copyOf(floors)
        );
    }

    private static Map<String, BackendConfig> parseBackends(Map<String, Map<String, Object>> backends,
                                                            UnaryOperator<String> env) {
        var result = new LinkedHashMap<String, BackendConfig>();
        backends.forEach((name, b) -> {
            var baseUrl = b.get("base-url");
            if (baseUrl == null) {
                throw new IllegalArgumentException("Backend " + name + " has no base-url");
            }
            result.put(name, new BackendConfig(
                String.valueOf(baseUrl),
                b.get("model") != null ? String.valueOf(b.get("model")) : null,
                expand(env, b.get("api-key") != null ? String.valueOf(b.get("api-key")) : "")
            ));
        });
        return Collections.unmodifiableMap(result);
    }

    private static List<String> stringList(Object value) {
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    private static String expand(UnaryOperator<String> env, String value) {
        var m = ENV_REF.matcher(value);
        if (!m.matches()) return value;
        var resolved = env.apply(m.group(1));
        return resolved != null ? resolved : "";
    }

    private static String envOrDefault(UnaryOperator<String> env, String name, String fallback) {
        var val = env.apply(name);
        return val != null ? val : fallback;
    }
}
