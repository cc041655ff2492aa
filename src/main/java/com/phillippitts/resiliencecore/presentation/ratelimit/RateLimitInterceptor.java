package com.phillippitts.resiliencecore.presentation.ratelimit;

import com.phillippitts.resiliencecore.config.properties.RateLimitProperties;
import com.phillippitts.resiliencecore.exception.RateLimitExceededException;
import com.phillippitts.resiliencecore.service.ratelimit.RateLimitDecision;
import com.phillippitts.resiliencecore.service.ratelimit.SlidingWindowRateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Applies sliding-window admission control to API requests.
 *
 * <p>Every checked response carries {@code X-RateLimit-Limit}, {@code X-RateLimit-Remaining}
 * and {@code X-RateLimit-Reset}. A rejected request raises {@link RateLimitExceededException},
 * which the global exception handler turns into HTTP 429.
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger LOG = LogManager.getLogger(RateLimitInterceptor.class);

    private final SlidingWindowRateLimiter limiter;
    private final ClientIdentityResolver identityResolver;
    private final RateLimitProperties properties;

    public RateLimitInterceptor(SlidingWindowRateLimiter limiter, ClientIdentityResolver identityResolver,
                                RateLimitProperties properties) {
        this.limiter = limiter;
        this.identityResolver = identityResolver;
        this.properties = properties;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!properties.isEnabled()) {
            return true;
        }
        String clientKey = identityResolver.resolve(request);
        String route = request.getRequestURI();
        RateLimitDecision decision = limiter.check(clientKey, route);
        RateLimitHeaders.write(response, decision.limit(), decision.remaining(), decision.resetSeconds());
        if (!decision.allowed()) {
            LOG.warn("Rejected request: route={}, limit={}/{}s, retryAfter={}s",
                    route, decision.limit(), decision.windowSeconds(), decision.resetSeconds());
            throw new RateLimitExceededException(decision.limit(), decision.resetSeconds(), decision.windowSeconds());
        }
        return true;
    }
}
