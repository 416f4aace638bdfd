package fr.lapetina.orchestrator.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Provider-agnostic chat request. The transport qualifies the model name
 * with the provider routing path.
 *
 * @param model       model name without provider prefix, e.g. {@code gpt-4o-mini}
 * @param messages    conversation, oldest first
 * @param temperature sampling temperature, null for provider default
 * @param maxTokens   completion limit, null for provider default
 */
public record ProviderRequest(
        String model,
        List<Message> messages,
        Double temperature,
        Integer maxTokens
) {
    public ProviderRequest {
        Objects.requireNonNull(model, "Model is required");
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("At least one message is required");
        }
        messages = List.copyOf(messages);
    }

    public static ProviderRequest of(String model, String systemPrompt, String userPrompt) {
        List<Message> messages = systemPrompt != null && !systemPrompt.isBlank()
                ? List.of(Message.system(systemPrompt), Message.user(userPrompt))
                : List.of(Message.user(userPrompt));
        return new ProviderRequest(model, messages, null, null);
    }

    public record Message(String role, String content) {
        public Message {
            Objects.requireNonNull(role, "Role is required");
            Objects.requireNonNull(content, "Content is required");
        }

        public static Message system(String content) {
            return new Message("system", content);
        }

        public static Message user(String content) {
            return new Message("user", content);
        }
    }
}
