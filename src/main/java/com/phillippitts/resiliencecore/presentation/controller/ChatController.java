package com.phillippitts.resiliencecore.presentation.controller;

import com.phillippitts.resiliencecore.domain.ModelRequest;
import com.phillippitts.resiliencecore.service.assistant.AssistantReply;
import com.phillippitts.resiliencecore.service.assistant.AssistantService;
import com.phillippitts.resiliencecore.util.LogSanitizer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Assistant chat endpoint. Admission control applies through the rate-limit interceptor.
 */
@RestController
@RequestMapping("/api/chat")
class ChatController {

    private static final Logger LOG = LogManager.getLogger(ChatController.class);

    private final AssistantService assistant;

    ChatController(AssistantService assistant) {
        this.assistant = assistant;
    }

    @PostMapping("/message")
    ResponseEntity<ChatResponse> message(@Valid @RequestBody ChatRequest body) {
        LOG.info("Chat request (chars={}, capability={}, preview='{}')",
                body.prompt().length(), body.capability(), LogSanitizer.preview(body.prompt(), 40));
        ModelRequest request = new ModelRequest(body.prompt(), body.systemPrompt(), body.temperature(), body.maxTokens());
        AssistantReply reply = assistant.reply(request, body.capability());
        return ResponseEntity.ok(new ChatResponse(reply.text(), reply.model(), reply.tier(), reply.cached()));
    }

    record ChatRequest(
            @NotBlank @Size(max = 32_000) String prompt,
            @Size(max = 8_000) String systemPrompt,
            String capability,
            @DecimalMin("0.0") @DecimalMax("2.0") Double temperature,
            @Min(1) Integer maxTokens
    ) { }

    record ChatResponse(String response, String model, int tier, boolean cached) { }
}
