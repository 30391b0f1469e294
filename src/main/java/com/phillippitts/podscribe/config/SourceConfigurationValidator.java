package com.phillippitts.podscribe.config;

import com.phillippitts.podscribe.config.properties.FeedProperties;
import com.phillippitts.podscribe.config.properties.ImportProperties;
import com.phillippitts.podscribe.config.stt.TranscriptionEngineProperties;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.net.URI;

/**
 * Fails startup with actionable messages when there is nothing to watch or a setting is unusable.
 */
@Component
class SourceConfigurationValidator {

    private final FeedProperties feeds;
    private final ImportProperties imports;
    private final TranscriptionEngineProperties engine;

    SourceConfigurationValidator(FeedProperties feeds, ImportProperties imports,
                                 TranscriptionEngineProperties engine) {
        this.feeds = feeds;
        this.imports = imports;
        this.engine = engine;
    }

    @PostConstruct
    void validate() {
        if (!feeds.hasFeeds() && !imports.isEnabled()) {
            throw new IllegalStateException("No sources configured: set podscribe.feeds.urls (PODCAST_FEEDS) "
                    + "and/or podscribe.import.dir (IMPORT_DIR)");
        }
        for (String url : feeds.urlList()) {
            URI uri;
            try {
                uri = URI.create(url);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid feed URL in podscribe.feeds.urls: '" + url + "'", e);
            }
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new IllegalArgumentException("Feed URL must be http or https: '" + url + "'");
            }
        }
        if (feeds.getCheckInterval().isZero() || feeds.getCheckInterval().isNegative()
                || imports.getCheckInterval().isZero() || imports.getCheckInterval().isNegative()) {
            throw new IllegalArgumentException("Check intervals must be positive");
        }
        if (feeds.getLookback().isNegative()) {
            throw new IllegalArgumentException("podscribe.feeds.lookback must not be negative");
        }
        // Rejects engine types other than faster-whisper and openai-whisper
        engine.engineType();
    }
}
