package com.phillippitts.podscribe.config;

import com.phillippitts.podscribe.config.properties.NotificationProperties;
import com.phillippitts.podscribe.service.notification.DiscordWebhookNotifier;
import com.phillippitts.podscribe.service.notification.LoggingNotifier;
import com.phillippitts.podscribe.service.notification.Notifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

/**
 * Chooses the notifier: Discord when a webhook URL is configured, log-only otherwise.
 */
@Configuration
public class NotificationConfig {

    private static final Logger LOG = LogManager.getLogger(NotificationConfig.class);

    @Bean
    public Notifier notifier(NotificationProperties props, HttpClient httpClient) {
        if (!props.webhookConfigured()) {
            LOG.info("No Discord webhook configured; completions are logged only");
            return new LoggingNotifier(props.excerptChars());
        }
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(props.timeout());
        RestClient restClient = RestClient.builder()
                .requestFactory(requestFactory)
                .build();
        LOG.info("Discord notifications enabled");
        return new DiscordWebhookNotifier(restClient, props.discordWebhookUrl(), props.maxAttachmentBytes());
    }
}
