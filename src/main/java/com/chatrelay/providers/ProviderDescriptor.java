package com.chatrelay.providers;

public record ProviderDescriptor(
    String name,
    ModelProvider capability,
    String model,
    Tier tier
) {}
