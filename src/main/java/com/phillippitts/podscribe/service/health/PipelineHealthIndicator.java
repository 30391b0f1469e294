package com.phillippitts.podscribe.service.health;

import com.phillippitts.podscribe.domain.PassSummary;
import com.phillippitts.podscribe.service.scheduling.PassScheduler;
import com.phillippitts.podscribe.service.state.ProcessedEpisodeStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of the ingestion loop.
 *
 * <ul>
 *   <li>UP: scheduler alive and the last pass read every feed</li>
 *   <li>DEGRADED: last pass skipped at least one feed</li>
 *   <li>DOWN: scheduler stopped</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health as {@code pipeline}.
 */
@Component
public class PipelineHealthIndicator implements HealthIndicator {

    private final PassScheduler scheduler;
    private final ProcessedEpisodeStore store;

    public PipelineHealthIndicator(PassScheduler scheduler, ProcessedEpisodeStore store) {
        this.scheduler = scheduler;
        this.store = store;
    }

    @Override
    public Health health() {
        PassScheduler.State state = scheduler.getState();
        Health.Builder builder;
        PassSummary last = scheduler.getLastSummary().orElse(null);
        if (state == PassScheduler.State.STOPPED) {
            builder = Health.down();
        } else if (last != null && last.feedErrors() > 0) {
            builder = Health.status("DEGRADED");
        } else {
            builder = Health.up();
        }
        builder.withDetail("state", state.name())
                .withDetail("passes", scheduler.getPassCount())
                .withDetail("processedEpisodes", store.size());
        if (last != null) {
            builder.withDetail("lastPassFinished", last.finishedAt().toString())
                    .withDetail("lastPassFailed", last.failed())
                    .withDetail("lastPassFeedErrors", last.feedErrors());
        }
        return builder.build();
    }
}
