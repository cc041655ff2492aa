package com.phillippitts.resiliencecore.service.routing.ollama;

import com.phillippitts.resiliencecore.domain.ModelRequest;
import com.phillippitts.resiliencecore.service.routing.InvocationOptions;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Builds and parses Ollama {@code /api/chat} payloads.
 *
 * <p>Request: {@code {"model": ..., "stream": false, "messages": [...], "options": {...}}}.
 * Response: {@code {"message": {"role": "assistant", "content": "..."}, "done": true}}, or
 * {@code {"error": "..."}} on failure.
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
final class OllamaJsonParser {

    /** Responses larger than this are rejected rather than parsed. */
    static final int MAX_JSON_SIZE = 4 * 1_048_576;

    private OllamaJsonParser() {
        // Utility class - prevent instantiation
    }

    static String chatRequest(String modelId, ModelRequest request, InvocationOptions options) {
        JSONArray messages = new JSONArray();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.put(message("system", request.systemPrompt()));
        }
        messages.put(message("user", request.prompt()));

        JSONObject modelOptions = new JSONObject()
                .put("temperature", options.temperature())
                .put("num_predict", options.maxTokens());

        return new JSONObject()
                .put("model", modelId)
                .put("stream", false)
                .put("messages", messages)
                .put("options", modelOptions)
                .toString();
    }

    /**
     * Extracts the assistant message content.
     *
     * @throws IllegalStateException if the body is empty, oversized, malformed or reports an error
     */
    static String chatContent(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalStateException("Empty response from Ollama");
        }
        if (json.length() > MAX_JSON_SIZE) {
            throw new IllegalStateException("Ollama response exceeds " + MAX_JSON_SIZE + " characters");
        }
        try {
            JSONObject obj = new JSONObject(json);
            if (obj.has("error")) {
                throw new IllegalStateException("Ollama error: " + obj.optString("error"));
            }
            JSONObject message = obj.optJSONObject("message");
            if (message == null) {
                throw new IllegalStateException("Ollama response has no message");
            }
            return message.optString("content", "").trim();
        } catch (JSONException e) {
            throw new IllegalStateException("Malformed Ollama response", e);
        }
    }

    private static JSONObject message(String role, String content) {
        return new JSONObject().put("role", role).put("content", content);
    }
}
