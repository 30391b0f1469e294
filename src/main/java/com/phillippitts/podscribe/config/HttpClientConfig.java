package com.phillippitts.podscribe.config;

import com.phillippitts.podscribe.config.properties.FeedProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Shared infrastructure beans: the JDK {@link HttpClient} used for feeds and downloads, and the
 * {@link Clock} every time-dependent decision reads from.
 */
@Configuration
public class HttpClientConfig {

    /**
     * One client for all outbound HTTP. Per-request timeouts are set by the callers; the connect
     * timeout and redirect policy apply to every request.
     */
    @Bean
    public HttpClient httpClient(FeedProperties feedProperties) {
        return clientBuilder(feedProperties.getConnectTimeout()).build();
    }

    /**
     * Redirects are followed across schemes too: enclosure URLs often pass through tracking prefixes
     * whose chain drops from https to http.
     */
    public static HttpClient.Builder clientBuilder(Duration connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.ALWAYS);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
