package com.phillippitts.resiliencecore.config.properties;

import com.phillippitts.resiliencecore.service.ratelimit.RateLimitRule;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sliding-window admission control settings ({@code resilience.rate-limit.*}).
 *
 * <p>Route overrides are keyed by path prefix, e.g.
 * {@code resilience.rate-limit.routes[/api/upload/].limit=10}.
 */
@Validated
@ConfigurationProperties(prefix = "resilience.rate-limit")
public class RateLimitProperties {

    private boolean enabled = true;

    @Min(1)
    private int defaultLimit = 60;

    @NotNull
    private Duration defaultWindow = Duration.ofSeconds(60);

    /**
     * How often idle client windows are dropped.
     */
    @Min(1000)
    private long evictionIntervalMs = 60_000;

    @Valid
    private Map<String, Route> routes = new LinkedHashMap<>();

    public RateLimitRule defaultRule() {
        return new RateLimitRule(defaultLimit, defaultWindow);
    }

    public Map<String, RateLimitRule> routeRules() {
        Map<String, RateLimitRule> rules = new LinkedHashMap<>();
        routes.forEach((prefix, route) -> rules.put(prefix, new RateLimitRule(route.getLimit(), route.getWindow())));
        return rules;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public Duration getDefaultWindow() {
        return defaultWindow;
    }

    public void setDefaultWindow(Duration defaultWindow) {
        this.defaultWindow = defaultWindow;
    }

    public long getEvictionIntervalMs() {
        return evictionIntervalMs;
    }

    public void setEvictionIntervalMs(long evictionIntervalMs) {
        this.evictionIntervalMs = evictionIntervalMs;
    }

    public Map<String, Route> getRoutes() {
        return routes;
    }

    public void setRoutes(Map<String, Route> routes) {
        this.routes = routes;
    }

    /**
     * Limit for one route prefix.
     */
    public static class Route {
        @Min(1)
        private int limit = 60;
        @NotNull
        private Duration window = Duration.ofSeconds(60);

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }
}
