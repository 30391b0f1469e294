package com.phillippitts.podscribe.config.logging;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.Map;

/**
 * Maps the single {@code podscribe.debug-logging} switch ({@code DEBUG_LOGGING}) onto logger levels.
 *
 * <p>When enabled, application loggers go to DEBUG (per-entry decisions, per-segment traces).
 * Explicit {@code logging.level.*} settings still win because this source is added last.
 */
public class VerbosityEnvironmentPostProcessor implements EnvironmentPostProcessor {

    static final String SWITCH = "podscribe.debug-logging";
    static final String SOURCE_NAME = "podscribeVerbosity";
    static final String APP_LOGGER = "logging.level.com.phillippitts.podscribe";

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        if (!environment.getProperty(SWITCH, Boolean.class, false)) {
            return;
        }
        environment.getPropertySources().addLast(new MapPropertySource(SOURCE_NAME, Map.of(APP_LOGGER, "DEBUG")));
    }
}
