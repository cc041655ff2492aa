package com.phillippitts.resiliencecore.service.routing.ollama;

import com.phillippitts.resiliencecore.config.properties.AssistantProperties;
import com.phillippitts.resiliencecore.domain.ModelRequest;
import com.phillippitts.resiliencecore.domain.ProviderType;
import com.phillippitts.resiliencecore.service.routing.InvocationOptions;
import com.phillippitts.resiliencecore.service.routing.ProviderHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * {@link ProviderHandler} for a local Ollama server ({@link ProviderType#LOCAL}).
 *
 * <p>Uses the JDK HTTP client so a blocked call stops when the router interrupts it on timeout.
 */
@Component
@ConditionalOnProperty(prefix = "assistant.providers.ollama", name = "enabled", havingValue = "true")
public class OllamaProviderHandler implements ProviderHandler {

    private static final Logger LOG = LogManager.getLogger(OllamaProviderHandler.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final RestClient restClient;

    @Autowired
    public OllamaProviderHandler(AssistantProperties properties, RestClient.Builder builder) {
        this(builder
                .baseUrl(properties.getProviders().getOllama().getBaseUrl())
                .requestFactory(new JdkClientHttpRequestFactory(HttpClient.newBuilder()
                        .connectTimeout(CONNECT_TIMEOUT)
                        .build()))
                .build());
        LOG.info("Ollama provider enabled at {}", properties.getProviders().getOllama().getBaseUrl());
    }

    OllamaProviderHandler(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public ProviderType provider() {
        return ProviderType.LOCAL;
    }

    @Override
    public String complete(String modelId, ModelRequest request, InvocationOptions options) {
        String body = OllamaJsonParser.chatRequest(modelId, request, options);
        String response = restClient.post()
                .uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(String.class);
        return OllamaJsonParser.chatContent(response);
    }
}
