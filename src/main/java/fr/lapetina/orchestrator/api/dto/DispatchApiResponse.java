package fr.lapetina.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.orchestrator.domain.exception.AggregatedDispatchException;
import fr.lapetina.orchestrator.domain.exception.ProviderException;
import fr.lapetina.orchestrator.domain.model.ProviderResponse;
import fr.lapetina.orchestrator.domain.model.Result;

import java.util.List;

/**
 * Body returned by {@code POST /api/dispatch}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DispatchApiResponse {

    private boolean success;
    private String provider;
    private String model;
    private String content;
    private String error;

    @JsonProperty("error_type")
    private String errorType;

    @JsonProperty("attempted_providers")
    private List<String> attemptedProviders;

    @JsonProperty("prompt_tokens")
    private Integer promptTokens;

    @JsonProperty("completion_tokens")
    private Integer completionTokens;

    @JsonProperty("latency_ms")
    private Long latencyMs;

    public static DispatchApiResponse fromResult(Result<ProviderResponse> result) {
        DispatchApiResponse api = new DispatchApiResponse();
        api.success = result.isSuccess();
        api.provider = result.providerId();

        if (result.isSuccess()) {
            ProviderResponse response = result.value();
            api.model = response.model();
            api.content = response.content();
            api.promptTokens = response.promptTokens();
            api.completionTokens = response.completionTokens();
            api.latencyMs = response.latencyMs();
            return api;
        }

        ProviderException failure = result.error();
        api.errorType = failure.getErrorType().name();
        api.error = failure.getMessage();
        if (failure instanceof AggregatedDispatchException aggregated) {
            api.attemptedProviders = aggregated.getAttemptedProviders();
        }
        return api;
    }

    // Getters
    public boolean isSuccess() { return success; }
    public String getProvider() { return provider; }
    public String getModel() { return model; }
    public String getContent() { return content; }
    public String getError() { return error; }
    public String getErrorType() { return errorType; }
    public List<String> getAttemptedProviders() { return attemptedProviders; }
    public Integer getPromptTokens() { return promptTokens; }
    public Integer getCompletionTokens() { return completionTokens; }
    public Long getLatencyMs() { return latencyMs; }
}
