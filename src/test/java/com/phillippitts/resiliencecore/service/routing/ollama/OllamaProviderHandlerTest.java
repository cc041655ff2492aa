package com.phillippitts.resiliencecore.service.routing.ollama;

import com.phillippitts.resiliencecore.domain.ModelRequest;
import com.phillippitts.resiliencecore.domain.ProviderType;
import com.phillippitts.resiliencecore.service.routing.InvocationOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OllamaProviderHandlerTest {

    private static final InvocationOptions OPTIONS = new InvocationOptions(128, 0.7, Duration.ofSeconds(5));

    private MockRestServiceServer server;
    private OllamaProviderHandler handler;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://ollama.test");
        server = MockRestServiceServer.bindTo(builder).build();
        handler = new OllamaProviderHandler(builder.build());
    }

    @Test
    void shouldPostChatRequestAndReturnContent() {
        server.expect(requestTo("http://ollama.test/api/chat"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.model").value("llama3:8b"))
                .andExpect(jsonPath("$.options.num_predict").value(128))
                .andRespond(withSuccess("{\"message\":{\"role\":\"assistant\",\"content\":\"pong\"},\"done\":true}",
                        MediaType.APPLICATION_JSON));

        String reply = handler.complete("llama3:8b", ModelRequest.of("ping"), OPTIONS);

        assertThat(reply).isEqualTo("pong");
        assertThat(handler.provider()).isEqualTo(ProviderType.LOCAL);
        server.verify();
    }

    @Test
    void shouldPropagateServerErrors() {
        server.expect(requestTo("http://ollama.test/api/chat"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> handler.complete("llama3:8b", ModelRequest.of("ping"), OPTIONS))
                .isInstanceOf(HttpServerErrorException.class);
    }
}
