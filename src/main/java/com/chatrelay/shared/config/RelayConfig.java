package com.chatrelay.shared.config;

import java.util.List;
import java.util.Map;

public record RelayConfig(
    int serverPort,
    String defaultProvider,
    List<String> candidates,
    List<String> backupProviders,
    String promotePattern,
    Map<String, List<String>> tierGroups,
    TimeoutConfig timeouts,
    Map<String, BackendConfig> backends
) {
    public static final List<String> DEFAULT_CANDIDATES = List.of(
        "Qwen_Qwen_2_72B", "Qwen_Qwen_2_5_Max", "Qwen_Qwen_2_5", "Qwen_Qwen_2_5M",
        "FreeGpt", "Liaobots", "HuggingChat", "DeepInfra", "You", "Gemini",
        "Phind", "Anthropic", "Blackbox", "ChatGpt"
    );

    public static final List<String> DEFAULT_BACKUPS = List.of(
        "Qwen_Qwen_2_72B", "Qwen_Qwen_2_5_Max", "Qwen_Qwen_2_5", "Qwen_Qwen_2_5M"
    );

    public static final Map<String, List<String>> DEFAULT_TIERS = Map.of(
        "primary", List.of("Qwen_Qwen_2_5_Max", "Qwen_Qwen_3", "You", "DeepInfra"),
        "secondary", List.of("Gemini", "GeminiPro", "Phind", "ChatGpt"),
        "fallback", List.of("You", "DeepInfra", "GPTalk", "FreeGpt", "GptGo")
    );
}
