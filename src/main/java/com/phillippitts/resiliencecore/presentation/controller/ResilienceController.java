package com.phillippitts.resiliencecore.presentation.controller;

import com.phillippitts.resiliencecore.service.cache.CacheStats;
import com.phillippitts.resiliencecore.service.cache.CoalescingFetchManager;
import com.phillippitts.resiliencecore.service.circuit.CircuitBreakerRegistry;
import com.phillippitts.resiliencecore.service.circuit.CircuitStatus;
import com.phillippitts.resiliencecore.service.routing.ModelHealth;
import com.phillippitts.resiliencecore.service.routing.TieredModelRouter;
import com.phillippitts.resiliencecore.service.routing.UsageReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Observability and operator actions for the resilience core.
 */
@RestController
@RequestMapping("/api/resilience")
class ResilienceController {

    private static final Logger LOG = LogManager.getLogger(ResilienceController.class);

    private final CoalescingFetchManager fetchManager;
    private final CircuitBreakerRegistry breakers;
    private final TieredModelRouter router;

    ResilienceController(CoalescingFetchManager fetchManager, CircuitBreakerRegistry breakers,
                         TieredModelRouter router) {
        this.fetchManager = fetchManager;
        this.breakers = breakers;
        this.router = router;
    }

    @GetMapping("/status")
    ResilienceStatus status() {
        return new ResilienceStatus(fetchManager.stats(), breakers.getAllStatus(),
                router.getUsageStats(), router.getHealthStatus());
    }

    @PostMapping("/circuits/{name}/reset")
    ResponseEntity<Map<String, Object>> resetCircuit(@PathVariable String name) {
        if (!breakers.reset(name)) {
            return ResponseEntity.notFound().build();
        }
        LOG.info("Operator reset circuit '{}'", name);
        return ResponseEntity.ok(Map.of("circuit", name, "reset", true));
    }

    @PostMapping("/circuits/reset")
    Map<String, Object> resetAllCircuits() {
        int count = breakers.resetAll();
        LOG.info("Operator reset all {} circuits", count);
        return Map.of("reset", count);
    }

    @DeleteMapping("/cache")
    Map<String, Object> invalidateCache(@RequestParam(defaultValue = "") String prefix) {
        int removed = fetchManager.invalidate(prefix);
        LOG.info("Operator invalidated {} cache entries (prefix='{}')", removed, prefix);
        return Map.of("prefix", prefix, "removed", removed);
    }

    record ResilienceStatus(
            CacheStats cache,
            List<CircuitStatus> circuits,
            UsageReport usage,
            Map<String, ModelHealth> models
    ) { }
}
