package com.phillippitts.podscribe.service.metrics;

import com.phillippitts.podscribe.service.processing.event.EpisodeFailedEvent;
import com.phillippitts.podscribe.service.processing.event.EpisodeProcessedEvent;
import com.phillippitts.podscribe.service.processing.event.PassCompletedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Feeds pipeline events into {@link PipelineMetrics}.
 */
@Component
class PipelineMetricsListener {

    private final PipelineMetrics metrics;

    PipelineMetricsListener(PipelineMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onProcessed(EpisodeProcessedEvent e) {
        metrics.recordProcessed(e.sourceKind().name().toLowerCase(Locale.ROOT), e.elapsed(), e.transcribeTime());
    }

    @EventListener
    void onFailed(EpisodeFailedEvent e) {
        metrics.incrementFailure(e.sourceKind().name().toLowerCase(Locale.ROOT), e.kind().name().toLowerCase(Locale.ROOT));
    }

    @EventListener
    void onPassCompleted(PassCompletedEvent e) {
        metrics.recordPass(e.summary().duration(), e.summary().feedErrors());
    }
}
