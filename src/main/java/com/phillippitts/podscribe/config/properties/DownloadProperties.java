package com.phillippitts.podscribe.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for episode audio downloads.
 *
 * @param requestTimeout  time allowed for the server to start responding to one attempt
 * @param transferTimeout time allowed for one whole attempt, body included
 * @param maxAttempts     attempts per episode and pass before the episode is failed
 * @param retryBackoff    pause between attempts
 */
@Validated
@ConfigurationProperties(prefix = "podscribe.download")
public record DownloadProperties(
        @DefaultValue("5m") Duration requestTimeout,
        @DefaultValue("30m") Duration transferTimeout,
        @Positive @DefaultValue("3") int maxAttempts,
        @DefaultValue("5s") Duration retryBackoff
) {
}
