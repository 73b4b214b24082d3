package com.chatrelay.gateway.http;

public record ChatBody(String message, String provider) {}
