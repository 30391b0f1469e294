package com.phillippitts.podscribe.service.stt.util;

import com.phillippitts.podscribe.service.stt.watchdog.EngineFailureEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

/**
 * Publishes engine failure events.
 *
 * <p>Null publishers are tolerated so engines can run without a Spring context in tests.
 *
 * @since 1.0
 */
public final class EngineEventPublisher {

    private EngineEventPublisher() {
        // Utility class - prevent instantiation
    }

    /**
     * @param publisher  the Spring event publisher (may be null)
     * @param engineName the engine that failed
     * @param message    short description of the failure
     * @param cause      the failure (may be null)
     * @param context    diagnostics such as audio file name or exit code (may be null)
     */
    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String engineName,
                                      String message,
                                      Throwable cause,
                                      Map<String, String> context) {
        if (publisher != null) {
            publisher.publishEvent(new EngineFailureEvent(
                    engineName,
                    Instant.now(),
                    message,
                    cause,
                    context
            ));
        }
    }
}
