package com.phillippitts.podscribe.config;

import com.phillippitts.podscribe.config.properties.FeedProperties;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class HttpClientConfigTest {

    @Test
    void sharedClientFollowsRedirectsAcrossSchemes() {
        FeedProperties feeds = new FeedProperties();
        feeds.setConnectTimeout(Duration.ofSeconds(7));

        HttpClient client = new HttpClientConfig().httpClient(feeds);

        assertThat(client.followRedirects()).isEqualTo(HttpClient.Redirect.ALWAYS);
        assertThat(client.connectTimeout()).contains(Duration.ofSeconds(7));
    }
}
