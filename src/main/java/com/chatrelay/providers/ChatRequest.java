package com.chatrelay.providers;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public record ChatRequest(
    String model,
    List<Map<String, Object>> messages,
    Duration timeout
) {
    public static ChatRequest user(String model, String prompt, Duration timeout) {
        return new ChatRequest(model, List.of(Map.of("role", "user", "content", prompt)), timeout);
    }
}
