package com.phillippitts.resiliencecore.domain;

/**
 * One failed routing attempt: which candidate and why it was abandoned.
 */
public record AttemptFailure(String modelName, String reason, Throwable cause) {

    @Override
    public String toString() {
        return modelName + "(" + reason + ")";
    }
}
