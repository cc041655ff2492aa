package com.phillippitts.resiliencecore.exception;

import com.phillippitts.resiliencecore.domain.ProviderType;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link HandlerFailureException} with contextual details.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw HandlerFailureExceptionBuilder.create("Provider call timed out")
 *         .model("gemini-pro")
 *         .provider(ProviderType.GOOGLE)
 *         .reason(HandlerFailureException.REASON_TIMEOUT)
 *         .timeout(Duration.ofSeconds(30))
 *         .metadata("modelId", "gemini-1.5-pro")
 *         .build();
 * </pre>
 *
 * <p>The final message format is
 * {@code {message} (timeoutMs={ms}, durationMs={ms}, {key}={value}, ...) (model: {model})}.
 */
public final class HandlerFailureExceptionBuilder {

    private final String message;
    private String modelName;
    private ProviderType provider;
    private String reason = HandlerFailureException.REASON_ERROR;
    private Throwable cause;
    private Long timeoutMs;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private HandlerFailureExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static HandlerFailureExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new HandlerFailureExceptionBuilder(message);
    }

    public HandlerFailureExceptionBuilder model(String modelName) {
        this.modelName = modelName;
        return this;
    }

    public HandlerFailureExceptionBuilder provider(ProviderType provider) {
        this.provider = provider;
        return this;
    }

    public HandlerFailureExceptionBuilder reason(String reason) {
        this.reason = reason;
        return this;
    }

    public HandlerFailureExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public HandlerFailureExceptionBuilder timeout(Duration timeout) {
        this.timeoutMs = timeout == null ? null : timeout.toMillis();
        return this;
    }

    public HandlerFailureExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata pair to the message. Null keys or values are ignored.
     */
    public HandlerFailureExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public HandlerFailureException build() {
        String detailedMessage = buildDetailedMessage();
        String model = modelName != null ? modelName : "unknown";
        if (cause != null) {
            return new HandlerFailureException(detailedMessage, model, provider, reason, cause);
        }
        return new HandlerFailureException(detailedMessage, model, provider, reason);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = timeoutMs != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (timeoutMs != null) {
            sb.append("timeoutMs=").append(timeoutMs);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
