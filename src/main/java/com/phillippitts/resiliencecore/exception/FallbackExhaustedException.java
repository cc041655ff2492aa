package com.phillippitts.resiliencecore.exception;

import com.phillippitts.resiliencecore.domain.AttemptFailure;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when every routing candidate was tried and none succeeded.
 * The cause is the last observed candidate failure, if any candidate was attempted.
 */
public class FallbackExhaustedException extends AssistantCoreException {

    private final List<String> attemptedModels;
    private final List<AttemptFailure> failures;

    public FallbackExhaustedException(String message, List<AttemptFailure> failures, Throwable lastError) {
        super(message + " (attempted: " + names(failures) + ")", lastError);
        this.failures = List.copyOf(failures);
        this.attemptedModels = names(failures);
    }

    public List<String> getAttemptedModels() {
        return attemptedModels;
    }

    public List<AttemptFailure> getFailures() {
        return failures;
    }

    private static List<String> names(List<AttemptFailure> failures) {
        return failures.stream().map(AttemptFailure::modelName).collect(Collectors.toUnmodifiableList());
    }
}
