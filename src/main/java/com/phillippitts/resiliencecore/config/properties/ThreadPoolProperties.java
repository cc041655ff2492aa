package com.phillippitts.resiliencecore.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools ({@code threadpool.*}).
 *
 * <p>The router pool runs provider calls so the calling thread can enforce per-model timeouts.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    @Valid
    private RouterPoolProperties router = new RouterPoolProperties();

    public RouterPoolProperties getRouter() {
        return router;
    }

    public void setRouter(RouterPoolProperties router) {
        this.router = router;
    }

    /**
     * Router executor pool configuration.
     */
    public static class RouterPoolProperties {
        @Min(1)
        private int corePoolSize = 4;
        @Min(1)
        private int maxPoolSize = 16;
        @Min(0)
        private int queueCapacity = 64;
        @Min(0)
        private int keepAliveSeconds = 60;
        @NotBlank
        private String threadNamePrefix = "router-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
