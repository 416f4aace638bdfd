package fr.lapetina.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.orchestrator.domain.model.ProviderRequest;

/**
 * Body of {@code POST /api/dispatch}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DispatchApiRequest {

    private String operation;
    private String model;
    private String tier;
    private String system;
    private String prompt;
    private Double temperature;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    // Getters and setters
    public String getOperation() { return operation; }
    public void setOperation(String operation) { this.operation = operation; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getTier() { return tier; }
    public void setTier(String tier) { this.tier = tier; }

    public String getSystem() { return system; }
    public void setSystem(String system) { this.system = system; }

    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }

    public Double getTemperature() { return temperature; }
    public void setTemperature(Double temperature) { this.temperature = temperature; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public Integer getMaxTokens() { return maxTokens; }
    public void setMaxTokens(Integer maxTokens) { this.maxTokens = maxTokens; }

    /**
     * Builds the provider request. An explicit {@code model} wins over the
     * provider model passed in.
     */
    public ProviderRequest toProviderRequest(String providerModel) {
        ProviderRequest base = ProviderRequest.of(model != null ? model : providerModel, system, prompt);
        return new ProviderRequest(base.model(), base.messages(), temperature, maxTokens);
    }
}
