package com.phillippitts.resiliencecore.exception;

import com.phillippitts.resiliencecore.domain.ProviderType;

/**
 * Thrown when a provider handler raised, timed out or could not be scheduled.
 * Carries the candidate model and a short machine-friendly reason.
 *
 * @see HandlerFailureExceptionBuilder
 */
public class HandlerFailureException extends AssistantCoreException {

    public static final String REASON_TIMEOUT = "timeout";
    public static final String REASON_ERROR = "error";
    public static final String REASON_REJECTED = "rejected";
    public static final String REASON_NO_HANDLER = "no_handler";

    private final String modelName;
    private final ProviderType provider;
    private final String reason;

    public HandlerFailureException(String message, String modelName, ProviderType provider, String reason) {
        super(message + " (model: " + modelName + ")");
        this.modelName = modelName;
        this.provider = provider;
        this.reason = reason;
    }

    public HandlerFailureException(String message, String modelName, ProviderType provider, String reason,
                                   Throwable cause) {
        super(message + " (model: " + modelName + ")", cause);
        this.modelName = modelName;
        this.provider = provider;
        this.reason = reason;
    }

    public String getModelName() {
        return modelName;
    }

    public ProviderType getProvider() {
        return provider;
    }

    public String getReason() {
        return reason;
    }
}
