package com.chatrelay.gateway.http;

public record ConvertBody(String imageUrl, Integer threshold) {}
