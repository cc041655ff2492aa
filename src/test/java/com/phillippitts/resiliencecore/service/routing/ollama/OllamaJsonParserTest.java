package com.phillippitts.resiliencecore.service.routing.ollama;

import com.phillippitts.resiliencecore.domain.ModelRequest;
import com.phillippitts.resiliencecore.service.routing.InvocationOptions;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OllamaJsonParserTest {

    private static final InvocationOptions OPTIONS = new InvocationOptions(256, 0.2, Duration.ofSeconds(10));

    @Test
    void shouldBuildChatRequestWithSystemPrompt() {
        String json = OllamaJsonParser.chatRequest("llama3:8b",
                new ModelRequest("Hello", "Be brief", null, null), OPTIONS);

        JSONObject obj = new JSONObject(json);
        assertThat(obj.getString("model")).isEqualTo("llama3:8b");
        assertThat(obj.getBoolean("stream")).isFalse();
        JSONArray messages = obj.getJSONArray("messages");
        assertThat(messages.length()).isEqualTo(2);
        assertThat(messages.getJSONObject(0).getString("role")).isEqualTo("system");
        assertThat(messages.getJSONObject(1).getString("content")).isEqualTo("Hello");
        assertThat(obj.getJSONObject("options").getInt("num_predict")).isEqualTo(256);
        assertThat(obj.getJSONObject("options").getDouble("temperature")).isEqualTo(0.2);
    }

    @Test
    void shouldOmitBlankSystemPrompt() {
        String json = OllamaJsonParser.chatRequest("m", new ModelRequest("Hi", " ", null, null), OPTIONS);

        assertThat(new JSONObject(json).getJSONArray("messages").length()).isEqualTo(1);
    }

    @Test
    void shouldExtractAssistantContent() {
        String json = "{\"message\":{\"role\":\"assistant\",\"content\":\"  Hi there \"},\"done\":true}";

        assertThat(OllamaJsonParser.chatContent(json)).isEqualTo("Hi there");
    }

    @Test
    void shouldRejectErrorPayload() {
        assertThatThrownBy(() -> OllamaJsonParser.chatContent("{\"error\":\"model not found\"}"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("model not found");
    }

    @Test
    void shouldRejectEmptyMalformedAndMessagelessBodies() {
        assertThatThrownBy(() -> OllamaJsonParser.chatContent(""))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> OllamaJsonParser.chatContent("{not json"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Malformed Ollama response");
        assertThatThrownBy(() -> OllamaJsonParser.chatContent("{\"done\":true}"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Ollama response has no message");
    }
}
