package com.phillippitts.resiliencecore.service.assistant;

import com.phillippitts.resiliencecore.config.properties.AssistantProperties;
import com.phillippitts.resiliencecore.domain.ModelRequest;
import com.phillippitts.resiliencecore.domain.RoutedResponse;
import com.phillippitts.resiliencecore.service.cache.CoalescingFetchManager;
import com.phillippitts.resiliencecore.service.cache.FetchOptions;
import com.phillippitts.resiliencecore.service.routing.TieredModelRouter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs assistant requests through the resilience pipeline: response cache with request
 * coalescing, then the tiered router, whose candidates each run behind their own breaker.
 *
 * <p>Identical requests share one cache entry and, while in flight, one model call.
 */
@Service
public class AssistantService {

    private static final Logger LOG = LogManager.getLogger(AssistantService.class);

    static final String CACHE_PREFIX = "chat";

    private final CoalescingFetchManager fetchManager;
    private final TieredModelRouter router;
    private final FetchOptions fetchOptions;

    public AssistantService(CoalescingFetchManager fetchManager, TieredModelRouter router,
                            AssistantProperties properties) {
        this.fetchManager = Objects.requireNonNull(fetchManager, "fetchManager");
        this.router = Objects.requireNonNull(router, "router");
        this.fetchOptions = new FetchOptions(properties.getCache().getResponseTtl(), CACHE_PREFIX, true);
    }

    /**
     * Answers the request from cache or by routing it to a model.
     *
     * @param capability capability the serving model must support; null for any
     */
    public AssistantReply reply(ModelRequest request, String capability) {
        Objects.requireNonNull(request, "request");
        String key = cacheKey(request, capability);
        AtomicBoolean computed = new AtomicBoolean(false);
        RoutedResponse response = fetchManager.getOrFetch(key, () -> {
            computed.set(true);
            return router.callWithFallback(request, capability);
        }, fetchOptions);
        boolean cached = !computed.get();
        LOG.debug("Reply from model={} cached={}", response.modelName(), cached);
        return new AssistantReply(response.text(), response.modelName(), response.tier(), cached);
    }

    /**
     * Drops all cached assistant replies.
     *
     * @return number of entries removed
     */
    public int invalidateResponses() {
        return fetchManager.invalidate(CACHE_PREFIX + ":");
    }

    static String cacheKey(ModelRequest request, String capability) {
        String material = String.join("\u0000",
                String.valueOf(capability),
                String.valueOf(request.systemPrompt()),
                String.valueOf(request.temperature()),
                String.valueOf(request.maxTokens()),
                request.prompt());
        return sha256(material);
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
