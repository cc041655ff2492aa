package com.phillippitts.resiliencecore.config.properties;

import com.phillippitts.resiliencecore.service.circuit.CircuitBreakerConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Circuit breaker thresholds.
 *
 * <p>{@code resilience.circuit-breaker.defaults.*} applies to every breaker;
 * {@code resilience.circuit-breaker.instances[<name>].*} overrides individual fields for one
 * breaker, e.g. {@code instances[model:gemini-pro].timeout=120s}.
 */
@Validated
@ConfigurationProperties(prefix = "resilience.circuit-breaker")
public class CircuitBreakerProperties {

    @Valid
    private Settings defaults = new Settings();

    @Valid
    private Map<String, Settings> instances = new LinkedHashMap<>();

    public Settings getDefaults() {
        return defaults;
    }

    public void setDefaults(Settings defaults) {
        this.defaults = defaults;
    }

    public Map<String, Settings> getInstances() {
        return instances;
    }

    public void setInstances(Map<String, Settings> instances) {
        this.instances = instances;
    }

    /** Config applied when neither an instance override nor a caller config is present. */
    public CircuitBreakerConfig defaultConfig() {
        return defaults.mergeOver(CircuitBreakerConfig.DEFAULT);
    }

    /**
     * One set of thresholds. Unset fields inherit from the config being overridden.
     */
    public static class Settings {
        @Min(1)
        private Integer failureThreshold;
        @Min(1)
        private Integer successThreshold;
        private Duration timeout;
        @Min(1)
        private Integer halfOpenMaxCalls;

        public Settings() {
        }

        public Settings(Integer failureThreshold, Integer successThreshold, Duration timeout,
                        Integer halfOpenMaxCalls) {
            this.failureThreshold = failureThreshold;
            this.successThreshold = successThreshold;
            this.timeout = timeout;
            this.halfOpenMaxCalls = halfOpenMaxCalls;
        }

        public CircuitBreakerConfig mergeOver(CircuitBreakerConfig base) {
            return new CircuitBreakerConfig(
                    failureThreshold != null ? failureThreshold : base.failureThreshold(),
                    successThreshold != null ? successThreshold : base.successThreshold(),
                    timeout != null ? timeout : base.timeout(),
                    halfOpenMaxCalls != null ? halfOpenMaxCalls : base.halfOpenMaxCalls());
        }

        public Integer getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(Integer failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Integer getSuccessThreshold() {
            return successThreshold;
        }

        public void setSuccessThreshold(Integer successThreshold) {
            this.successThreshold = successThreshold;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Integer getHalfOpenMaxCalls() {
            return halfOpenMaxCalls;
        }

        public void setHalfOpenMaxCalls(Integer halfOpenMaxCalls) {
            this.halfOpenMaxCalls = halfOpenMaxCalls;
        }
    }
}
