package com.phillippitts.resiliencecore;

import com.phillippitts.resiliencecore.config.properties.AssistantProperties;
import com.phillippitts.resiliencecore.config.properties.CacheProperties;
import com.phillippitts.resiliencecore.config.properties.CircuitBreakerProperties;
import com.phillippitts.resiliencecore.config.properties.RateLimitProperties;
import com.phillippitts.resiliencecore.config.properties.RouterProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        CacheProperties.class,
        CircuitBreakerProperties.class,
        RouterProperties.class,
        RateLimitProperties.class,
        AssistantProperties.class
})
@EnableScheduling
public class ResilienceCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResilienceCoreApplication.class, args);
    }

}
