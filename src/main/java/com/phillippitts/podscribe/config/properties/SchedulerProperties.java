package com.phillippitts.podscribe.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Typed properties for the pass scheduler.
 */
@ConfigurationProperties(prefix = "podscribe.scheduler")
public class SchedulerProperties {

    /** Disable to run passes only on demand (tests, one-off maintenance). */
    private boolean enabled = true;

    /** Delay before the first pass after startup. */
    private Duration initialDelay = Duration.ofSeconds(5);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
    }
}
