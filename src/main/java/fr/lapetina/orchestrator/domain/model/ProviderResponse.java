package fr.lapetina.orchestrator.domain.model;

/**
 * Completion returned by a provider.
 *
 * @param providerId       provider that answered
 * @param model            fully qualified model reported by the gateway
 * @param content          generated text
 * @param promptTokens     tokens consumed by the prompt, 0 when not reported
 * @param completionTokens tokens generated, 0 when not reported
 * @param latencyMs        round-trip time of the call
 */
public record ProviderResponse(
        String providerId,
        String model,
        String content,
        int promptTokens,
        int completionTokens,
        long latencyMs
) {
    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}
