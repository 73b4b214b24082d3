package com.chatrelay.gateway.http;

/** {@code timeout} is in seconds. */
public record DirectBody(String message, String provider, String model, Double timeout) {}
