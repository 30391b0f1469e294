package com.phillippitts.podscribe.service.processing.event;

import com.phillippitts.podscribe.domain.PassSummary;

/**
 * Published at the end of every pass, including passes that found nothing to do.
 */
public record PassCompletedEvent(PassSummary summary) {
}
