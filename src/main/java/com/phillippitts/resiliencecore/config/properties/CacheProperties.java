package com.phillippitts.resiliencecore.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the shared expiring cache ({@code resilience.cache.*}).
 */
@Validated
@ConfigurationProperties(prefix = "resilience.cache")
public class CacheProperties {

    @Min(1)
    private final int maxSize;

    @NotNull
    private final Duration defaultTtl;

    @ConstructorBinding
    public CacheProperties(Integer maxSize, Duration defaultTtl) {
        this.maxSize = maxSize == null ? 1000 : maxSize;
        this.defaultTtl = defaultTtl == null ? Duration.ofSeconds(300) : defaultTtl;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }
}
