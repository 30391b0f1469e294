package com.phillippitts.podscribe.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Counters for one completed pass.
 *
 * @param passId      short pass identifier used in log context
 * @param startedAt   pass start
 * @param finishedAt  pass end
 * @param discovered  candidates discovered across all sources before filtering
 * @param selected    candidates in the ordered work list (including mid-pass imports)
 * @param succeeded   candidates fully processed and committed
 * @param skipped     candidates skipped by the processor
 * @param failed      candidates that failed and will be retried
 * @param feedErrors  feeds that could not be fetched or parsed this pass
 */
public record PassSummary(
        String passId,
        Instant startedAt,
        Instant finishedAt,
        int discovered,
        int selected,
        int succeeded,
        int skipped,
        int failed,
        int feedErrors
) {

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
