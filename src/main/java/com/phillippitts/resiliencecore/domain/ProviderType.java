package com.phillippitts.resiliencecore.domain;

import java.util.Locale;

/**
 * Upstream model providers the router can dispatch to.
 */
public enum ProviderType {
    GOOGLE,
    OPENAI,
    ANTHROPIC,
    LOCAL;

    /** Lower-case identifier used in logs, metrics tags and reports. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
