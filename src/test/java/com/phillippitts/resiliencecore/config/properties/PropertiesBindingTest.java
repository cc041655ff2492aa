package com.phillippitts.resiliencecore.config.properties;

import com.phillippitts.resiliencecore.domain.ModelConfig;
import com.phillippitts.resiliencecore.domain.ProviderType;
import com.phillippitts.resiliencecore.service.circuit.CircuitBreakerConfig;
import com.phillippitts.resiliencecore.service.ratelimit.RateLimitRule;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PropertiesBindingTest {

    private static Binder binder(Map<String, String> properties) {
        return new Binder(new MapConfigurationPropertySource(properties));
    }

    @Test
    void shouldBindRouterModelsAndBreakerOverrides() {
        RouterProperties router = binder(Map.of(
                "assistant.router.models[0].name", "gemini-pro",
                "assistant.router.models[0].tier", "1",
                "assistant.router.models[0].provider", "GOOGLE",
                "assistant.router.models[0].model-id", "gemini-1.5-pro",
                "assistant.router.models[0].cost-per1k-tokens", "0.00125",
                "assistant.router.models[0].capabilities", "chat,code",
                "assistant.router.models[0].timeout", "45s",
                "assistant.router.breaker.failure-threshold", "2"))
                .bind("assistant.router", RouterProperties.class).get();

        List<ModelConfig> models = router.toModelConfigs();
        assertThat(models).hasSize(1);
        ModelConfig model = models.get(0);
        assertThat(model.provider()).isEqualTo(ProviderType.GOOGLE);
        assertThat(model.costPer1kTokens()).isEqualTo(0.00125);
        assertThat(model.capabilities()).containsExactlyInAnyOrder("chat", "code");
        assertThat(model.timeout()).isEqualTo(Duration.ofSeconds(45));
        assertThat(router.breakerConfig()).isEqualTo(new CircuitBreakerConfig(2, 3, Duration.ofSeconds(60), 3));
    }

    @Test
    void shouldBindRouteOverridesKeyedByPath() {
        RateLimitProperties rateLimit = binder(Map.of(
                "resilience.rate-limit.default-limit", "100",
                "resilience.rate-limit.routes[/api/upload/].limit", "10",
                "resilience.rate-limit.routes[/api/upload/].window", "30s"))
                .bind("resilience.rate-limit", RateLimitProperties.class).get();

        assertThat(rateLimit.defaultRule()).isEqualTo(new RateLimitRule(100, Duration.ofSeconds(60)));
        assertThat(rateLimit.routeRules())
                .containsEntry("/api/upload/", new RateLimitRule(10, Duration.ofSeconds(30)));
    }

    @Test
    void shouldBindCircuitBreakerDefaultsAndInstances() {
        CircuitBreakerProperties breakers = binder(Map.of(
                "resilience.circuit-breaker.defaults.failure-threshold", "7",
                "resilience.circuit-breaker.instances[search].timeout", "2m"))
                .bind("resilience.circuit-breaker", CircuitBreakerProperties.class).get();

        assertThat(breakers.defaultConfig().failureThreshold()).isEqualTo(7);
        assertThat(breakers.getInstances().get("search").mergeOver(breakers.defaultConfig()).timeout())
                .isEqualTo(Duration.ofMinutes(2));
    }

    @Test
    void cachePropertiesFallBackToDefaults() {
        CacheProperties cache = new CacheProperties(null, null);

        assertThat(cache.getMaxSize()).isEqualTo(1000);
        assertThat(cache.getDefaultTtl()).isEqualTo(Duration.ofSeconds(300));
    }
}
