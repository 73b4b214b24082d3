package com.chatrelay.shared.config;

import java.util.Map;

public record TimeoutConfig(
    int defaultSeconds,
    int maxSeconds,
    Map<String, Integer> floors
) {
    public static TimeoutConfig defaults() {
        return new TimeoutConfig(20, 60, Map.of(
            "Qwen_Qwen_2_72B", 45,
            "Qwen_Qwen_2_5_Max", 30,
            "Qwen_Qwen_2_5", 30
        ));
    }
}
