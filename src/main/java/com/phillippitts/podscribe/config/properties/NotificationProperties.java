package com.phillippitts.podscribe.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for completion notifications.
 *
 * @param discordWebhookUrl  Discord webhook; blank selects the log-only notifier
 * @param maxAttachmentBytes transcripts larger than this are announced without the file attached
 * @param timeout            request timeout for webhook delivery
 * @param excerptChars       characters of transcript text included in log-only notifications
 */
@Validated
@ConfigurationProperties(prefix = "podscribe.notification")
public record NotificationProperties(
        @DefaultValue("") String discordWebhookUrl,
        @Positive @DefaultValue("8178892") long maxAttachmentBytes,
        @DefaultValue("30s") Duration timeout,
        @Positive @DefaultValue("280") int excerptChars
) {

    public boolean webhookConfigured() {
        return discordWebhookUrl != null && !discordWebhookUrl.isBlank();
    }
}
