package com.chatrelay.gateway.http;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

public record StreamBody(
    String message,
    String provider,
    @JsonProperty("timeout_ms") @JsonAlias("timeout") Double timeoutMs
) {}
