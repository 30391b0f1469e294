package com.phillippitts.podscribe.service.stt.watchdog;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs engine failures with their diagnostics, throttled per engine and message so a
 * broken engine does not flood the log on every episode.
 */
@Component
class EngineFailureListener {

    private static final Logger LOG = LogManager.getLogger(EngineFailureListener.class);

    static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    EngineFailureListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onEngineFailure(EngineFailureEvent e) {
        String key = e.engine() + '-' + e.message();
        if (shouldLog(key)) {
            LOG.warn("Engine failure: engine={}, message={}, context={}, cause={}",
                    e.engine(), e.message(), e.context(),
                    e.cause() == null ? "none" : e.cause().toString());
        } else {
            LOG.debug("Engine failure (throttled): engine={}, message={}", e.engine(), e.message());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
