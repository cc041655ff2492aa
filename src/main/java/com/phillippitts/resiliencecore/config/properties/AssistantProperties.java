package com.phillippitts.resiliencecore.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Assistant pipeline and bundled provider settings ({@code assistant.*}).
 */
@Validated
@ConfigurationProperties(prefix = "assistant")
public class AssistantProperties {

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Providers providers = new Providers();

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Providers getProviders() {
        return providers;
    }

    public void setProviders(Providers providers) {
        this.providers = providers;
    }

    /**
     * Response caching for assistant replies.
     */
    public static class Cache {
        @NotNull
        private Duration responseTtl = Duration.ofSeconds(300);

        public Duration getResponseTtl() {
            return responseTtl;
        }

        public void setResponseTtl(Duration responseTtl) {
            this.responseTtl = responseTtl;
        }
    }

    public static class Providers {
        @Valid
        private Ollama ollama = new Ollama();

        public Ollama getOllama() {
            return ollama;
        }

        public void setOllama(Ollama ollama) {
            this.ollama = ollama;
        }
    }

    /**
     * Local Ollama server used for the LOCAL provider.
     */
    public static class Ollama {
        private boolean enabled;
        @NotBlank
        private String baseUrl = "http://localhost:11434";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
