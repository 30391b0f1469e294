package com.phillippitts.podscribe.service.processing.event;

import com.phillippitts.podscribe.domain.FailureKind;
import com.phillippitts.podscribe.domain.SourceKind;

/**
 * Published when an episode fails; it stays eligible for the next pass.
 *
 * @param identifier episode identifier
 * @param sourceKind feed or import
 * @param kind       failed stage
 * @param reason     exception message, no transcript text
 */
public record EpisodeFailedEvent(
        String identifier,
        SourceKind sourceKind,
        FailureKind kind,
        String reason
) {
}
