package com.phillippitts.resiliencecore.service.health;

import com.phillippitts.resiliencecore.service.routing.ModelHealth;
import com.phillippitts.resiliencecore.service.routing.TieredModelRouter;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the tiered model router.
 *
 * <p>Reports routing health for monitoring and alerting:
 * <ul>
 *   <li>UP: every configured model available</li>
 *   <li>DEGRADED: at least one model available</li>
 *   <li>DOWN: no model available</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health as {@code modelRouter}.
 */
@Component
public class ModelRouterHealthIndicator implements HealthIndicator {

    private final TieredModelRouter router;

    public ModelRouterHealthIndicator(TieredModelRouter router) {
        this.router = router;
    }

    @Override
    public Health health() {
        Map<String, ModelHealth> models = router.getHealthStatus();
        long available = models.values().stream().filter(ModelHealth::available).count();

        Health.Builder builder = new Health.Builder();
        if (!models.isEmpty() && available == models.size()) {
            builder.up().withDetail("status", "All models available");
        } else if (available > 0) {
            builder.status("DEGRADED").withDetail("status", "Partial model availability");
        } else {
            builder.down().withDetail("status", "No models available");
        }
        router.getCurrentModel().ifPresent(m -> builder.withDetail("currentModel", m.name()));
        return builder.withDetail("models", describe(models)).build();
    }

    private static Map<String, String> describe(Map<String, ModelHealth> models) {
        Map<String, String> details = new LinkedHashMap<>();
        models.forEach((name, health) -> details.put(name,
                "tier=" + health.tier() + ", circuit=" + health.circuitState()
                        + (health.available() ? ", available" : ", unavailable")));
        return details;
    }
}
