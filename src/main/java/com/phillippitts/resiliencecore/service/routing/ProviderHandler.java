package com.phillippitts.resiliencecore.service.routing;

import com.phillippitts.resiliencecore.domain.ModelRequest;
import com.phillippitts.resiliencecore.domain.ProviderType;

/**
 * Adapter to one upstream model provider. Invoked only by {@link TieredModelRouter}.
 *
 * <p>Implementations may block on network I/O. They should respond to thread interruption,
 * which the router uses to cancel calls that exceed the model's timeout.
 */
public interface ProviderHandler {

    /** Provider served by this handler; at most one handler per provider. */
    ProviderType provider();

    /**
     * Sends the request to the given model.
     *
     * @param modelId provider-specific model identifier
     * @param request completion request
     * @param options resolved per-call limits
     * @return response text
     * @throws RuntimeException on any provider failure
     */
    String complete(String modelId, ModelRequest request, InvocationOptions options);
}
