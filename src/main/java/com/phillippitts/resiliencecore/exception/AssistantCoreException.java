package com.phillippitts.resiliencecore.exception;

/**
 * Base exception for all resilience-core errors.
 * Domain exceptions extend this class so the web layer can map them in one place.
 */
public class AssistantCoreException extends RuntimeException {

    public AssistantCoreException(String message) {
        super(message);
    }

    public AssistantCoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public AssistantCoreException(Throwable cause) {
        super(cause);
    }
}
