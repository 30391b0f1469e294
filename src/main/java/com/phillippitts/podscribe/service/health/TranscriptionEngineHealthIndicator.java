package com.phillippitts.podscribe.service.health;

import com.phillippitts.podscribe.service.stt.TranscriptionEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the selected engine is initialized. Exposed as {@code transcriptionEngine}.
 */
@Component
public class TranscriptionEngineHealthIndicator implements HealthIndicator {

    private final TranscriptionEngine engine;

    public TranscriptionEngineHealthIndicator(TranscriptionEngine engine) {
        this.engine = engine;
    }

    @Override
    public Health health() {
        Health.Builder builder = engine.isHealthy() ? Health.up() : Health.down();
        return builder.withDetail("engine", engine.getEngineName())
                .withDetail("status", engine.isHealthy() ? "ready" : "not initialized or closed")
                .build();
    }
}
