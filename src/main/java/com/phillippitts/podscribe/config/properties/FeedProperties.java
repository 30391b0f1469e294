package com.phillippitts.podscribe.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;

/**
 * Typed properties for RSS feed polling.
 *
 * <p>Example application.properties:
 * <pre>
 * podscribe.feeds.urls=https://a.example/rss;https://b.example/feed.xml
 * podscribe.feeds.check-interval=3600
 * podscribe.feeds.lookback=7
 * </pre>
 *
 * <p>Bare numbers are read as seconds for the check interval and as days for the lookback window,
 * matching the {@code CHECK_INTERVAL_SECONDS} and {@code LOOKBACK_DAYS} environment variables.
 */
@Validated
@ConfigurationProperties(prefix = "podscribe.feeds")
public class FeedProperties {

    /** Feed URLs separated by ';' (newlines are accepted too). */
    private String urls = "";

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration checkInterval = Duration.ofHours(1);

    @NotNull
    @DurationUnit(ChronoUnit.DAYS)
    private Duration lookback = Duration.ofDays(7);

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration connectTimeout = Duration.ofSeconds(10);

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration requestTimeout = Duration.ofSeconds(60);

    public String getUrls() {
        return urls;
    }

    public void setUrls(String urls) {
        this.urls = urls;
    }

    /**
     * Parsed feed list in configuration order, blanks removed.
     */
    public List<String> urlList() {
        if (urls == null || urls.isBlank()) {
            return List.of();
        }
        return Arrays.stream(urls.split("[;\\n]"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public boolean hasFeeds() {
        return !urlList().isEmpty();
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(Duration checkInterval) {
        this.checkInterval = checkInterval;
    }

    public Duration getLookback() {
        return lookback;
    }

    public void setLookback(Duration lookback) {
        this.lookback = lookback;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }
}
