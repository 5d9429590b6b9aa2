package com.ivamare.interactions.health;

import com.ivamare.interactions.dispatch.ContinuationSupervisor;
import com.ivamare.interactions.handler.HandlerRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Health indicator for interaction dispatch.
 *
 * <p>Reports:
 * <ul>
 *   <li>Number of registered handlers</li>
 *   <li>In-flight, completed and failed background continuations</li>
 *   <li>Down when the continuation supervisor is stopped</li>
 * </ul>
 */
public class InteractionsHealthIndicator implements HealthIndicator {

    private final HandlerRegistry registry;
    private final ContinuationSupervisor supervisor;

    public InteractionsHealthIndicator(HandlerRegistry registry, ContinuationSupervisor supervisor) {
        this.registry = registry;
        this.supervisor = supervisor;
    }

    @Override
    public Health health() {
        int handlers = registry.size();
        if (!supervisor.isRunning()) {
            return Health.down()
                .withDetail("error", "Continuation supervisor stopped")
                .withDetail("handlers", handlers)
                .build();
        }

        Health.Builder builder = handlers == 0
            ? Health.unknown().withDetail("message", "No handlers registered")
            : Health.up();

        return builder
            .withDetail("handlers", handlers)
            .withDetail("inFlightContinuations", supervisor.inFlightCount())
            .withDetail("completedContinuations", supervisor.completedCount())
            .withDetail("failedContinuations", supervisor.failedCount())
            .build();
    }
}
