package com.phillippitts.podscribe.config.logging;

import com.phillippitts.podscribe.domain.EpisodeCandidate;
import org.apache.logging.log4j.ThreadContext;

/**
 * Scoped Log4j2 MDC (ThreadContext) values for pipeline work.
 *
 * <p>Keys:</p>
 * <ul>
 *   <li>passId: short id of the running pass</li>
 *   <li>episodeId: first 8 hex chars of the episode identifier</li>
 *   <li>source: FEED or IMPORT</li>
 * </ul>
 *
 * <p>Use with try-with-resources; closing removes exactly the keys this scope added.</p>
 */
public final class PipelineLogContext implements AutoCloseable {

    public static final String PASS_ID = "passId";
    public static final String EPISODE_ID = "episodeId";
    public static final String SOURCE = "source";

    private final String[] keys;

    private PipelineLogContext(String... keys) {
        this.keys = keys;
    }

    public static PipelineLogContext forPass(String passId) {
        ThreadContext.put(PASS_ID, passId);
        return new PipelineLogContext(PASS_ID);
    }

    public static PipelineLogContext forEpisode(EpisodeCandidate candidate) {
        ThreadContext.put(EPISODE_ID, candidate.shortId());
        ThreadContext.put(SOURCE, candidate.sourceKind().name());
        return new PipelineLogContext(EPISODE_ID, SOURCE);
    }

    @Override
    public void close() {
        for (String key : keys) {
            ThreadContext.remove(key);
        }
    }
}
