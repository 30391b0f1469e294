package com.phillippitts.podscribe.service.selection;

import com.phillippitts.podscribe.domain.EpisodeCandidate;
import com.phillippitts.podscribe.service.state.ProcessedEpisodeStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges feed and import candidates into the ordered work list of one pass.
 *
 * <ol>
 *   <li>Feed candidates older than {@code now - lookback} are dropped; the boundary itself is kept.
 *       Undated entries are kept. Imports are never filtered by age.</li>
 *   <li>Already processed identifiers are dropped, as are repeats within the pass (first one wins).</li>
 *   <li>Imports come first in their given order, then feeds by publish time (undated last),
 *       feed position and identifier.</li>
 * </ol>
 */
@Component
public class CandidateSelector {

    private static final Logger LOG = LogManager.getLogger(CandidateSelector.class);

    static final Comparator<EpisodeCandidate> FEED_ORDER = Comparator
            .comparing(EpisodeCandidate::publishedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingInt(EpisodeCandidate::feedOrder)
            .thenComparing(EpisodeCandidate::identifier);

    public List<EpisodeCandidate> select(List<EpisodeCandidate> feedCandidates,
                                         List<EpisodeCandidate> importCandidates,
                                         Duration lookback,
                                         ProcessedEpisodeStore store,
                                         Instant now) {
        Instant cutoff = now.minus(lookback);
        Set<String> seen = new HashSet<>();

        List<EpisodeCandidate> imports = new ArrayList<>();
        for (EpisodeCandidate c : importCandidates) {
            if (admit(c, store, seen)) {
                imports.add(c);
            }
        }

        List<EpisodeCandidate> feeds = new ArrayList<>();
        int tooOld = 0;
        for (EpisodeCandidate c : feedCandidates) {
            if (c.publishedAt() == null) {
                LOG.debug("Keeping undated feed entry '{}' ({})", c.title(), c.shortId());
            } else if (c.publishedAt().isBefore(cutoff)) {
                tooOld++;
                continue;
            }
            if (admit(c, store, seen)) {
                feeds.add(c);
            }
        }
        feeds.sort(FEED_ORDER);

        List<EpisodeCandidate> selected = new ArrayList<>(imports.size() + feeds.size());
        selected.addAll(imports);
        selected.addAll(feeds);
        LOG.info("Selected {} candidate(s): {} import(s), {} feed episode(s); {} outside {} lookback",
                selected.size(), imports.size(), feeds.size(), tooOld, lookback);
        return selected;
    }

    private static boolean admit(EpisodeCandidate c, ProcessedEpisodeStore store, Set<String> seen) {
        if (store.isProcessed(c.identifier())) {
            LOG.debug("Already processed: '{}' ({})", c.title(), c.shortId());
            return false;
        }
        if (!seen.add(c.identifier())) {
            LOG.debug("Duplicate within pass: '{}' ({})", c.title(), c.shortId());
            return false;
        }
        return true;
    }
}
