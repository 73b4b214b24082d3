package com.chatrelay.shared.config;

public record BackendConfig(
    String baseUrl,
    String model,
    String apiKey
) {}
