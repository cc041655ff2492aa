package com.phillippitts.resiliencecore.service.routing;

import java.util.Map;

/**
 * Router usage: per-model totals in tier order, the model that served the last successful call
 * (null before any success), and the summed estimated cost.
 */
public record UsageReport(Map<String, ModelUsage.Snapshot> models, String currentModel, double totalCost) { }
