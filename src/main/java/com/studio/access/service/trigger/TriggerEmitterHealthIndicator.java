package com.studio.access.service.trigger;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TriggerEmitterHealthIndicator implements HealthIndicator {

    private final TriggerEmitter triggerEmitter;

    @Override
    public Health health() {
        if (triggerEmitter.isConnected()) {
            return Health.up().withDetail("mode", "connected").build();
        }
        return Health.unknown().withDetail("mode", "disconnected").build();
    }
}
