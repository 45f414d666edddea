package com.williamcallahan.llmrouter.domain;

import java.util.Objects;

/**
 * One candidate completion.
 *
 * @param index position the vendor assigned to this choice
 * @param message generated message with role and content
 * @param finishReason vendor stop reason, or null when not reported
 */
public record ChatChoice(int index, ChatMessage message, String finishReason) {
    public ChatChoice {
        Objects.requireNonNull(message, "message");
    }
}
