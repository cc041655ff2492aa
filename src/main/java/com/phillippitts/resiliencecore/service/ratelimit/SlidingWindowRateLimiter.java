package com.phillippitts.resiliencecore.service.ratelimit;

import com.phillippitts.resiliencecore.config.properties.RateLimitProperties;
import com.phillippitts.resiliencecore.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-client, per-route admission control over a true rolling window.
 *
 * <p>Each {@code (clientKey, route)} pair keeps the instants of its admitted requests. A check
 * drops instants at or before {@code now - window}; if the remaining count has reached the
 * limit the request is rejected, otherwise {@code now} is recorded and the request admitted.
 * Checks for the same pair are serialized through {@link ConcurrentHashMap#compute}.
 *
 * <p>The rule for a route is the override with the longest matching path prefix, or the default.
 */
@Component
public class SlidingWindowRateLimiter {

    private static final Logger LOG = LogManager.getLogger(SlidingWindowRateLimiter.class);

    private final RateLimitRule defaultRule;
    private final Map<String, RateLimitRule> routeRules;
    private final Duration longestWindow;
    private final Clock clock;
    private final ConcurrentMap<String, Deque<Instant>> windows = new ConcurrentHashMap<>();

    @Autowired
    public SlidingWindowRateLimiter(RateLimitProperties properties, Clock clock) {
        this(properties.defaultRule(), properties.routeRules(), clock);
    }

    public SlidingWindowRateLimiter(RateLimitRule defaultRule, Map<String, RateLimitRule> routeRules, Clock clock) {
        this.defaultRule = Objects.requireNonNull(defaultRule, "defaultRule");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.routeRules = longestPrefixFirst(routeRules == null ? Map.of() : routeRules);
        this.longestWindow = this.routeRules.values().stream()
                .map(RateLimitRule::window)
                .reduce(defaultRule.window(), (a, b) -> a.compareTo(b) >= 0 ? a : b);
    }

    /**
     * Admits or rejects one request and reports the window state.
     */
    public RateLimitDecision check(String clientKey, String route) {
        Objects.requireNonNull(clientKey, "clientKey");
        String path = route == null ? "" : route;
        RateLimitRule rule = resolveRule(path);
        Instant now = clock.instant();
        Instant cutoff = now.minus(rule.window());
        RateLimitDecision[] decision = new RateLimitDecision[1];

        windows.compute(windowKey(clientKey, path), (key, existing) -> {
            Deque<Instant> window = existing != null ? existing : new ArrayDeque<>();
            while (!window.isEmpty() && !window.peekFirst().isAfter(cutoff)) {
                window.pollFirst();
            }
            if (window.size() >= rule.limit()) {
                long reset = Math.max(1, secondsUntilExit(window.peekFirst(), rule, now));
                decision[0] = RateLimitDecision.rejected(rule, reset);
            } else {
                window.addLast(now);
                decision[0] = RateLimitDecision.allowed(rule, rule.limit() - window.size(),
                        secondsUntilExit(window.peekFirst(), rule, now));
            }
            return window;
        });

        if (!decision[0].allowed()) {
            LOG.debug("Rate limit exceeded: client={}, route={}, limit={}/{}s, reset={}s",
                    clientKey, path, rule.limit(), rule.windowSeconds(), decision[0].resetSeconds());
        }
        return decision[0];
    }

    public RateLimitRule resolveRule(String route) {
        if (route != null) {
            for (Map.Entry<String, RateLimitRule> entry : routeRules.entrySet()) {
                if (route.startsWith(entry.getKey())) {
                    return entry.getValue();
                }
            }
        }
        return defaultRule;
    }

    /**
     * Drops windows whose newest request is older than the longest configured window.
     *
     * @return number of windows removed
     */
    public int evictIdleWindows() {
        Instant cutoff = clock.instant().minus(longestWindow);
        int removed = 0;
        for (String key : windows.keySet()) {
            boolean[] idle = new boolean[1];
            windows.computeIfPresent(key, (k, window) -> {
                Instant newest = window.peekLast();
                idle[0] = newest == null || !newest.isAfter(cutoff);
                return idle[0] ? null : window;
            });
            if (idle[0]) {
                removed++;
            }
        }
        if (removed > 0) {
            LOG.debug("Evicted {} idle rate-limit windows ({} remain)", removed, windows.size());
        }
        return removed;
    }

    @Scheduled(fixedDelayString = "${resilience.rate-limit.eviction-interval-ms:60000}")
    void scheduledEviction() {
        evictIdleWindows();
    }

    public int trackedWindows() {
        return windows.size();
    }

    public void reset() {
        windows.clear();
    }

    private static long secondsUntilExit(Instant oldest, RateLimitRule rule, Instant now) {
        return TimeUtils.ceilSeconds(Duration.between(now, oldest.plus(rule.window())));
    }

    private static String windowKey(String clientKey, String route) {
        return clientKey + '|' + route;
    }

    private static Map<String, RateLimitRule> longestPrefixFirst(Map<String, RateLimitRule> rules) {
        Map<String, RateLimitRule> ordered = new LinkedHashMap<>();
        rules.entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, RateLimitRule> e) -> e.getKey().length())
                        .reversed())
                .forEachOrdered(e -> ordered.put(e.getKey(), e.getValue()));
        return ordered;
    }
}
