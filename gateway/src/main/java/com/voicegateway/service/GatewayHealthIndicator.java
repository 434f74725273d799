package com.voicegateway.service;

import com.voicegateway.model.CapabilityHealth;
import com.voicegateway.model.CapabilityKind;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Actuator view of the capability health, exposed as {@code voiceGateway}.
 *
 * <ul>
 *   <li>UP: configured and no capability failed its last request</li>
 *   <li>DEGRADED: configured, at least one capability failed its last request</li>
 *   <li>DOWN: no configuration has been applied</li>
 * </ul>
 */
@Component("voiceGateway")
public class GatewayHealthIndicator implements HealthIndicator {

    private final CapabilityRegistry registry;
    private final StatusReporter statusReporter;

    public GatewayHealthIndicator(CapabilityRegistry registry, StatusReporter statusReporter) {
        this.registry = registry;
        this.statusReporter = statusReporter;
    }

    @Override
    public Health health() {
        long version = registry.currentVersion();
        if (version == 0) {
            return Health.down()
                    .withDetail("status", "No configuration applied")
                    .withDetail("version", version)
                    .build();
        }

        Map<CapabilityKind, CapabilityHealth> report = statusReporter.report();
        boolean failing = report.values().stream()
                .anyMatch(health -> health.state() == CapabilityHealth.State.FAILED);

        Health.Builder builder = failing
                ? Health.status("DEGRADED").withDetail("status", "Some capabilities are failing")
                : Health.up().withDetail("status", "All capabilities operational");
        builder.withDetail("version", version);
        report.forEach((kind, health) -> builder.withDetail(kind.key(), describe(health)));
        return builder.build();
    }

    private static String describe(CapabilityHealth health) {
        String state = health.state().name().toLowerCase();
        if (health.state() == CapabilityHealth.State.FAILED && health.getLastErrorKind() != null) {
            state = state + " (" + health.getLastErrorKind().code() + ")";
        }
        return health.getProviderName() + ": " + state;
    }
}
