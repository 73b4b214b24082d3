package com.chatrelay.providers;

import java.util.Iterator;

/**
 * A backend capability: given a prompt, return text or a sequence of text
 * chunks. Implementations throw {@link ProviderException} (or any other
 * runtime exception) on failure.
 */
public interface ModelProvider {
    String id();
    ChatResponse chat(ChatRequest request);
    Iterator<ChatEvent> chatStream(ChatRequest request);
}
