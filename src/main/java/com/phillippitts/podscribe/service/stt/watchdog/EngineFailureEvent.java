package com.phillippitts.podscribe.service.stt.watchdog;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a transcription engine run fails (timeout, non-zero exit, unreadable output).
 *
 * <p>Context holds technical diagnostics only, never transcript text.
 */
public record EngineFailureEvent(
        String engine,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public EngineFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
