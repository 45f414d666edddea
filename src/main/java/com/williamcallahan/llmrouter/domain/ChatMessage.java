package com.williamcallahan.llmrouter.domain;

/**
 * One turn of a chat conversation in canonical form.
 *
 * @param role speaker role such as {@code system}, {@code user} or {@code assistant}
 * @param content message text, may be empty but never null
 */
public record ChatMessage(String role, String content) {
    public ChatMessage {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("Chat message role is required");
        }
        content = content == null ? "" : content;
    }
}
