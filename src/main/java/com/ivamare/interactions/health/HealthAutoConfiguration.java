package com.ivamare.interactions.health;

import com.ivamare.interactions.InteractionsAutoConfiguration;
import com.ivamare.interactions.dispatch.ContinuationSupervisor;
import com.ivamare.interactions.handler.HandlerRegistry;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for interaction dispatch health indicators.
 */
@AutoConfiguration(after = InteractionsAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnProperty(prefix = "interactions", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(InteractionsHealthIndicator.class)
    @ConditionalOnBean({HandlerRegistry.class, ContinuationSupervisor.class})
    public InteractionsHealthIndicator interactionsHealthIndicator(
            HandlerRegistry handlerRegistry,
            ContinuationSupervisor continuationSupervisor) {
        return new InteractionsHealthIndicator(handlerRegistry, continuationSupervisor);
    }
}
