package com.chatrelay.providers;

public record ChatResponse(
    String model,
    String content
) {
    public boolean hasContent() {
        return content != null && !content.isBlank();
    }
}
