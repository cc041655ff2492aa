package com.phillippitts.resiliencecore.config.properties;

import com.phillippitts.resiliencecore.domain.ModelConfig;
import com.phillippitts.resiliencecore.domain.ProviderType;
import com.phillippitts.resiliencecore.service.circuit.CircuitBreakerConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Model list and breaker thresholds for the tiered router ({@code assistant.router.*}).
 */
@Validated
@ConfigurationProperties(prefix = "assistant.router")
public class RouterProperties {

    /** Model breakers trip faster and cool down longer than the generic default. */
    public static final CircuitBreakerConfig MODEL_BREAKER_DEFAULT =
            new CircuitBreakerConfig(3, 3, Duration.ofSeconds(60), 3);

    @Valid
    private List<ModelProperties> models = new ArrayList<>();

    @Valid
    private CircuitBreakerProperties.Settings breaker = new CircuitBreakerProperties.Settings();

    public List<ModelProperties> getModels() {
        return models;
    }

    public void setModels(List<ModelProperties> models) {
        this.models = models;
    }

    public CircuitBreakerProperties.Settings getBreaker() {
        return breaker;
    }

    public void setBreaker(CircuitBreakerProperties.Settings breaker) {
        this.breaker = breaker;
    }

    public List<ModelConfig> toModelConfigs() {
        return models.stream().map(ModelProperties::toModelConfig).toList();
    }

    public CircuitBreakerConfig breakerConfig() {
        return breaker.mergeOver(MODEL_BREAKER_DEFAULT);
    }

    /**
     * One configured model.
     */
    public static class ModelProperties {
        @NotBlank
        private String name;
        @Min(1)
        private int tier = 1;
        @NotNull
        private ProviderType provider;
        @NotBlank
        private String modelId;
        @Min(1)
        private int maxTokens = 4096;
        private double temperature = ModelConfig.DEFAULT_TEMPERATURE;
        private Duration timeout = ModelConfig.DEFAULT_TIMEOUT;
        @PositiveOrZero
        private double costPer1kTokens;
        private Set<String> capabilities = new LinkedHashSet<>();

        public ModelConfig toModelConfig() {
            return new ModelConfig(name, tier, provider, modelId, maxTokens, temperature, timeout,
                    costPer1kTokens, capabilities);
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getTier() {
            return tier;
        }

        public void setTier(int tier) {
            this.tier = tier;
        }

        public ProviderType getProvider() {
            return provider;
        }

        public void setProvider(ProviderType provider) {
            this.provider = provider;
        }

        public String getModelId() {
            return modelId;
        }

        public void setModelId(String modelId) {
            this.modelId = modelId;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public double getCostPer1kTokens() {
            return costPer1kTokens;
        }

        public void setCostPer1kTokens(double costPer1kTokens) {
            this.costPer1kTokens = costPer1kTokens;
        }

        public Set<String> getCapabilities() {
            return capabilities;
        }

        public void setCapabilities(Set<String> capabilities) {
            this.capabilities = capabilities;
        }
    }
}
