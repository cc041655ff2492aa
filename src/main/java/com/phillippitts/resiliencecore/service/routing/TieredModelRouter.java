package com.phillippitts.resiliencecore.service.routing;

import com.phillippitts.resiliencecore.config.properties.RouterProperties;
import com.phillippitts.resiliencecore.domain.AttemptFailure;
import com.phillippitts.resiliencecore.domain.ModelConfig;
import com.phillippitts.resiliencecore.domain.ModelRequest;
import com.phillippitts.resiliencecore.domain.ProviderType;
import com.phillippitts.resiliencecore.domain.RoutedResponse;
import com.phillippitts.resiliencecore.exception.CircuitOpenException;
import com.phillippitts.resiliencecore.exception.FallbackExhaustedException;
import com.phillippitts.resiliencecore.exception.HandlerFailureException;
import com.phillippitts.resiliencecore.exception.HandlerFailureExceptionBuilder;
import com.phillippitts.resiliencecore.service.circuit.CircuitBreaker;
import com.phillippitts.resiliencecore.service.circuit.CircuitBreakerConfig;
import com.phillippitts.resiliencecore.service.circuit.CircuitBreakerRegistry;
import com.phillippitts.resiliencecore.service.metrics.RouterMetrics;
import com.phillippitts.resiliencecore.service.routing.event.AllModelsFailedEvent;
import com.phillippitts.resiliencecore.service.routing.event.ModelFallbackEvent;
import com.phillippitts.resiliencecore.util.LogSanitizer;
import com.phillippitts.resiliencecore.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Routes completion requests across configured models in tier order, falling back on failure.
 *
 * <p>For each call the candidate list is the configured models, filtered by capability and by
 * breaker availability, sorted ascending by tier (configuration order breaks ties). Candidates
 * are tried one at a time. Each provider call runs on the router executor under the model's
 * timeout and inside the model's own breaker ({@code model:<name>}), so one unhealthy model
 * never affects another. A timed-out call is cancelled with interruption and counts as a failure.
 *
 * <p>If the calling thread is interrupted, the in-flight provider call is cancelled and a
 * {@link CancellationException} is thrown without trying further candidates.
 */
@Service
public class TieredModelRouter {

    private static final Logger LOG = LogManager.getLogger(TieredModelRouter.class);

    static final String REASON_CIRCUIT_OPEN = "circuit_open";

    private final List<ModelConfig> models;
    private final Map<ProviderType, ProviderHandler> handlers;
    private final CircuitBreakerRegistry breakers;
    private final CircuitBreakerConfig breakerConfig;
    private final Executor executor;
    private final RouterMetrics metrics;
    private final ApplicationEventPublisher publisher;

    private final Map<String, ModelUsage> usage = new ConcurrentHashMap<>();
    private final AtomicReference<ModelConfig> currentModel = new AtomicReference<>();

    @Autowired
    public TieredModelRouter(RouterProperties properties,
                             ObjectProvider<ProviderHandler> handlers,
                             CircuitBreakerRegistry breakers,
                             @Qualifier("routerExecutor") Executor executor,
                             RouterMetrics metrics,
                             ApplicationEventPublisher publisher) {
        this(properties.toModelConfigs(), handlers.orderedStream().toList(), breakers,
                properties.breakerConfig(), executor, metrics, publisher);
    }

    public TieredModelRouter(List<ModelConfig> models,
                             Collection<? extends ProviderHandler> handlers,
                             CircuitBreakerRegistry breakers,
                             CircuitBreakerConfig breakerConfig,
                             Executor executor,
                             RouterMetrics metrics,
                             ApplicationEventPublisher publisher) {
        this.breakers = Objects.requireNonNull(breakers, "breakers");
        this.breakerConfig = Objects.requireNonNull(breakerConfig, "breakerConfig");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.models = sortByTier(models);
        this.handlers = indexHandlers(handlers);
        for (ModelConfig model : this.models) {
            usage.put(model.name(), new ModelUsage());
            if (!this.handlers.containsKey(model.provider())) {
                LOG.warn("No handler registered for provider {}; model {} will be skipped",
                        model.provider().id(), model.name());
            }
        }
        LOG.info("Model router initialized: models={}, providers={}",
                this.models.stream().map(ModelConfig::name).toList(), this.handlers.keySet());
    }

    /**
     * Returns the first successful response, trying candidates in tier order.
     *
     * @param request            completion request
     * @param requiredCapability capability every candidate must support; null for any
     * @return response and the model that produced it
     * @throws FallbackExhaustedException if no candidate succeeded, or none was available
     * @throws CancellationException if the calling thread was interrupted
     */
    public RoutedResponse callWithFallback(ModelRequest request, String requiredCapability) {
        Objects.requireNonNull(request, "request");
        List<ModelConfig> candidates = getAvailableModels(requiredCapability);
        List<AttemptFailure> failures = new ArrayList<>();
        RuntimeException lastError = null;

        if (candidates.isEmpty()) {
            LOG.warn("No models available for capability={}", requiredCapability);
        }

        for (ModelConfig model : candidates) {
            checkNotCancelled();
            ProviderHandler handler = handlers.get(model.provider());
            if (handler == null) {
                HandlerFailureException missing = HandlerFailureExceptionBuilder
                        .create("No handler registered for provider")
                        .model(model.name())
                        .provider(model.provider())
                        .reason(HandlerFailureException.REASON_NO_HANDLER)
                        .build();
                lastError = missing;
                recordFailure(model, failures, missing.getReason(), missing);
                continue;
            }

            long start = System.nanoTime();
            try {
                String text = breakerFor(model).call(() -> invoke(model, handler, request));
                long elapsedNanos = System.nanoTime() - start;
                return onSuccess(model, request, text, elapsedNanos, failures);
            } catch (CircuitOpenException e) {
                lastError = e;
                recordFailure(model, failures, REASON_CIRCUIT_OPEN, e);
            } catch (HandlerFailureException e) {
                lastError = e;
                recordFailure(model, failures, e.getReason(), e);
            }
        }

        List<String> attempted = failures.stream().map(AttemptFailure::modelName).toList();
        LOG.error("All models failed: capability={}, attempted={}", requiredCapability, failures);
        metrics.incrementExhausted();
        publisher.publishEvent(new AllModelsFailedEvent(requiredCapability, attempted, Instant.now()));
        String message = candidates.isEmpty() ? "No models available" : "All models failed";
        throw new FallbackExhaustedException(message, failures, lastError);
    }

    /**
     * Models that support the capability and whose breaker would admit a call, in tier order.
     *
     * @param capability required capability; null for any
     */
    public List<ModelConfig> getAvailableModels(String capability) {
        return models.stream()
                .filter(m -> capability == null || m.supports(capability))
                .filter(m -> breakerFor(m).isAvailable())
                .toList();
    }

    public List<ModelConfig> getModels() {
        return models;
    }

    /** Model that served the most recent successful call. */
    public Optional<ModelConfig> getCurrentModel() {
        return Optional.ofNullable(currentModel.get());
    }

    public UsageReport getUsageStats() {
        Map<String, ModelUsage.Snapshot> perModel = new LinkedHashMap<>();
        double total = 0.0;
        for (ModelConfig model : models) {
            ModelUsage.Snapshot snapshot = usage.get(model.name()).snapshot();
            perModel.put(model.name(), snapshot);
            total += snapshot.estimatedCost();
        }
        ModelConfig current = currentModel.get();
        return new UsageReport(perModel, current == null ? null : current.name(),
                Math.round(total * 1_000_000.0) / 1_000_000.0);
    }

    public Map<String, ModelHealth> getHealthStatus() {
        Map<String, ModelHealth> health = new LinkedHashMap<>();
        for (ModelConfig model : models) {
            CircuitBreaker breaker = breakerFor(model);
            boolean available = handlers.containsKey(model.provider()) && breaker.isAvailable();
            health.put(model.name(), new ModelHealth(model.tier(), model.provider(), breaker.getState(), available));
        }
        return health;
    }

    private RoutedResponse onSuccess(ModelConfig model, ModelRequest request, String text,
                                     long elapsedNanos, List<AttemptFailure> failures) {
        usage.get(model.name()).record(request.inputLength(), text.length(), model.costPer1kTokens());
        currentModel.set(model);
        metrics.recordLatency(model.name(), elapsedNanos);
        metrics.incrementSuccess(model.name());
        if (!failures.isEmpty()) {
            metrics.incrementFallback(model.name());
            LOG.info("Served by fallback model {} (tier {}) after {}", model.name(), model.tier(), failures);
        } else {
            LOG.debug("Served by model {} (tier {})", model.name(), model.tier());
        }
        return new RoutedResponse(text, model.name(), model.tier(),
                TimeUtils.nanosToMillis(elapsedNanos), failures);
    }

    private void recordFailure(ModelConfig model, List<AttemptFailure> failures, String reason,
                               RuntimeException error) {
        LOG.warn("Model {} failed ({}): {}", model.name(), reason, error.getMessage());
        failures.add(new AttemptFailure(model.name(), reason, error));
        metrics.incrementFailure(model.name(), reason);
        publisher.publishEvent(new ModelFallbackEvent(model.name(), reason, Instant.now()));
    }

    /**
     * Runs one provider call on the executor, waiting at most the model's timeout.
     * Every failure surfaces as {@link HandlerFailureException} so the breaker counts it.
     */
    private String invoke(ModelConfig model, ProviderHandler handler, ModelRequest request) {
        InvocationOptions options = InvocationOptions.resolve(model, request);
        FutureTask<String> task = new FutureTask<>(() -> handler.complete(model.modelId(), request, options));
        long start = System.nanoTime();
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            throw failure("Router executor rejected provider call", model, HandlerFailureException.REASON_REJECTED)
                    .cause(e)
                    .build();
        }

        String text;
        try {
            text = task.get(model.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            throw failure("Provider call timed out", model, HandlerFailureException.REASON_TIMEOUT)
                    .timeout(model.timeout())
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .build();
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Routing cancelled during call to " + model.name());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw failure("Provider call failed", model, HandlerFailureException.REASON_ERROR)
                    .cause(cause)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .metadata("error", LogSanitizer.truncate(String.valueOf(cause), 200))
                    .build();
        }

        if (text == null || text.isBlank()) {
            throw failure("Provider returned an empty response", model, HandlerFailureException.REASON_ERROR)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .build();
        }
        return text;
    }

    private static HandlerFailureExceptionBuilder failure(String message, ModelConfig model, String reason) {
        return HandlerFailureExceptionBuilder.create(message)
                .model(model.name())
                .provider(model.provider())
                .reason(reason)
                .metadata("modelId", model.modelId());
    }

    private CircuitBreaker breakerFor(ModelConfig model) {
        return breakers.getOrCreate(model.circuitName(), breakerConfig);
    }

    private static void checkNotCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Routing cancelled");
        }
    }

    private static List<ModelConfig> sortByTier(List<ModelConfig> configured) {
        Set<String> names = new HashSet<>();
        for (ModelConfig model : configured) {
            if (!names.add(model.name())) {
                throw new IllegalArgumentException("Duplicate model name: " + model.name());
            }
        }
        // List.sort is stable, so equal tiers keep configuration order
        List<ModelConfig> sorted = new ArrayList<>(configured);
        sorted.sort(Comparator.comparingInt(ModelConfig::tier));
        return List.copyOf(sorted);
    }

    private static Map<ProviderType, ProviderHandler> indexHandlers(Collection<? extends ProviderHandler> handlers) {
        Map<ProviderType, ProviderHandler> byProvider = new EnumMap<>(ProviderType.class);
        for (ProviderHandler handler : handlers) {
            ProviderHandler previous = byProvider.putIfAbsent(handler.provider(), handler);
            if (previous != null) {
                throw new IllegalStateException("Multiple handlers registered for provider " + handler.provider());
            }
        }
        return byProvider;
    }
}
