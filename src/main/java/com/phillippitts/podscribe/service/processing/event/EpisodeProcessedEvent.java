package com.phillippitts.podscribe.service.processing.event;

import com.phillippitts.podscribe.domain.SourceKind;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Published after an episode is committed to the state store.
 *
 * @param identifier     episode identifier
 * @param sourceKind     feed or import
 * @param transcriptPath final transcript file
 * @param segments       number of transcript segments
 * @param elapsed        wall time from acquire to commit
 * @param transcribeTime time spent in the engine
 */
public record EpisodeProcessedEvent(
        String identifier,
        SourceKind sourceKind,
        Path transcriptPath,
        int segments,
        Duration elapsed,
        Duration transcribeTime
) {
}
