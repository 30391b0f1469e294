package com.phillippitts.podscribe.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer instrumentation for the ingestion pipeline.
 *
 * <p>Provides:
 * <ul>
 *   <li>{@code podscribe.episode.processed} / {@code podscribe.episode.failed} counters by source and failure kind</li>
 *   <li>{@code podscribe.episode.duration} and {@code podscribe.episode.transcription} timers</li>
 *   <li>{@code podscribe.pass.duration} timer and {@code podscribe.pass.feed.errors} counter</li>
 * </ul>
 *
 * <p>Exposed at /actuator/metrics.
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "podscribe";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordProcessed(String source, Duration elapsed, Duration transcribeTime) {
        Counter.builder(METRIC_PREFIX + ".episode.processed")
                .description("Episodes fully processed and committed")
                .tag("source", source)
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".episode.duration")
                .description("Time from acquire to commit")
                .tag("source", source)
                .register(registry)
                .record(elapsed);
        Timer.builder(METRIC_PREFIX + ".episode.transcription")
                .description("Time spent in the transcription engine")
                .tag("source", source)
                .register(registry)
                .record(transcribeTime);
    }

    public void incrementFailure(String source, String kind) {
        Counter.builder(METRIC_PREFIX + ".episode.failed")
                .description("Episodes that failed and will be retried")
                .tag("source", source)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordPass(Duration duration, int feedErrors) {
        Timer.builder(METRIC_PREFIX + ".pass.duration")
                .description("Wall time of a discovery and processing pass")
                .register(registry)
                .record(duration);
        if (feedErrors > 0) {
            Counter.builder(METRIC_PREFIX + ".pass.feed.errors")
                    .description("Feeds skipped because they could not be fetched or parsed")
                    .register(registry)
                    .increment(feedErrors);
        }
    }
}
