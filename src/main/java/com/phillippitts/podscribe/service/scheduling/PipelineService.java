package com.phillippitts.podscribe.service.scheduling;

import com.phillippitts.podscribe.config.logging.PipelineLogContext;
import com.phillippitts.podscribe.config.properties.FeedProperties;
import com.phillippitts.podscribe.config.properties.ImportProperties;
import com.phillippitts.podscribe.domain.EpisodeCandidate;
import com.phillippitts.podscribe.domain.PassSummary;
import com.phillippitts.podscribe.domain.ProcessingOutcome;
import com.phillippitts.podscribe.exception.FeedFetchException;
import com.phillippitts.podscribe.exception.FeedParseException;
import com.phillippitts.podscribe.exception.StateStoreException;
import com.phillippitts.podscribe.service.feed.FeedSource;
import com.phillippitts.podscribe.service.importer.ImportSource;
import com.phillippitts.podscribe.service.processing.EpisodeProcessor;
import com.phillippitts.podscribe.service.processing.event.PassCompletedEvent;
import com.phillippitts.podscribe.service.selection.CandidateSelector;
import com.phillippitts.podscribe.service.state.ProcessedEpisodeStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One discovery and processing pass.
 *
 * <ol>
 *   <li>Fetch every configured feed; a failing feed is logged and skipped for this pass</li>
 *   <li>Resume staged imports, then scan the import root</li>
 *   <li>Select and order the work list</li>
 *   <li>Process candidates one at a time. Before each feed episode the import root is scanned
 *       again so files dropped mid-pass are handled first</li>
 * </ol>
 *
 * <p>Imports whose identifier is already recorded are moved to quarantine instead of being rescanned
 * forever. A {@link StateStoreException} aborts the pass and propagates to the scheduler.
 */
@Service
public class PipelineService {

    private static final Logger LOG = LogManager.getLogger(PipelineService.class);

    private final FeedSource feedSource;
    private final ImportSource importSource;
    private final CandidateSelector selector;
    private final EpisodeProcessor processor;
    private final ProcessedEpisodeStore store;
    private final FeedProperties feedProperties;
    private final ImportProperties importProperties;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public PipelineService(FeedSource feedSource,
                           ImportSource importSource,
                           CandidateSelector selector,
                           EpisodeProcessor processor,
                           ProcessedEpisodeStore store,
                           FeedProperties feedProperties,
                           ImportProperties importProperties,
                           ApplicationEventPublisher publisher,
                           Clock clock) {
        this.feedSource = feedSource;
        this.importSource = importSource;
        this.selector = selector;
        this.processor = processor;
        this.store = store;
        this.feedProperties = feedProperties;
        this.importProperties = importProperties;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * Runs a full pass.
     *
     * @param passId short id placed in the log context
     * @throws StateStoreException if a commit fails
     */
    public PassSummary runPass(String passId) {
        try (PipelineLogContext ignored = PipelineLogContext.forPass(passId)) {
            Instant startedAt = clock.instant();
            LOG.info("Pass started");

            Tally tally = new Tally();
            List<EpisodeCandidate> feedCandidates = fetchFeeds(tally);

            List<EpisodeCandidate> importCandidates = new ArrayList<>(importSource.recoverStaged());
            importCandidates.addAll(importSource.scan());
            importCandidates = quarantineProcessed(importCandidates);
            tally.discovered = feedCandidates.size() + importCandidates.size();

            List<EpisodeCandidate> work = selector.select(feedCandidates, importCandidates,
                    feedProperties.getLookback(), store, startedAt);
            tally.selected = work.size();

            Set<String> attempted = new HashSet<>();
            for (EpisodeCandidate candidate : work) {
                if (!candidate.isImport()) {
                    processNewImports(attempted, tally);
                }
                if (attempted.add(candidate.identifier())) {
                    record(processor.process(candidate), tally);
                }
            }

            PassSummary summary = new PassSummary(passId, startedAt, clock.instant(), tally.discovered,
                    tally.selected, tally.succeeded, tally.skipped, tally.failed, tally.feedErrors);
            LOG.info("Pass finished in {} s: discovered={}, selected={}, succeeded={}, skipped={}, failed={}, "
                            + "feedErrors={}", summary.duration().toSeconds(), summary.discovered(),
                    summary.selected(), summary.succeeded(), summary.skipped(), summary.failed(),
                    summary.feedErrors());
            publisher.publishEvent(new PassCompletedEvent(summary));
            return summary;
        }
    }

    private List<EpisodeCandidate> fetchFeeds(Tally tally) {
        List<String> urls = feedProperties.urlList();
        List<EpisodeCandidate> all = new ArrayList<>();
        for (int i = 0; i < urls.size(); i++) {
            String url = urls.get(i);
            try {
                all.addAll(feedSource.fetch(url, i));
            } catch (FeedFetchException | FeedParseException e) {
                tally.feedErrors++;
                LOG.warn("Skipping feed {} this pass: {}", url, e.getMessage());
            } catch (RuntimeException e) {
                tally.feedErrors++;
                LOG.error("Unexpected error reading feed {}; skipping it this pass", url, e);
            }
        }
        return all;
    }

    private void processNewImports(Set<String> attempted, Tally tally) {
        if (!importProperties.isRescanBetweenEpisodes() || !importSource.isEnabled()) {
            return;
        }
        List<EpisodeCandidate> fresh = new ArrayList<>();
        for (EpisodeCandidate c : quarantineProcessed(importSource.scan())) {
            if (!attempted.contains(c.identifier())) {
                fresh.add(c);
            }
        }
        if (fresh.isEmpty()) {
            return;
        }
        LOG.info("{} new import(s) appeared mid-pass; processing them before the next feed episode", fresh.size());
        tally.discovered += fresh.size();
        tally.selected += fresh.size();
        for (EpisodeCandidate c : fresh) {
            attempted.add(c.identifier());
            record(processor.process(c), tally);
        }
    }

    private List<EpisodeCandidate> quarantineProcessed(List<EpisodeCandidate> imports) {
        List<EpisodeCandidate> pending = new ArrayList<>(imports.size());
        for (EpisodeCandidate c : imports) {
            if (!store.isProcessed(c.identifier())) {
                pending.add(c);
                continue;
            }
            LOG.warn("Import {} was already transcribed; moving it out of the import folder", c.importPath().getFileName());
            try {
                importSource.quarantine(c.importPath());
            } catch (RuntimeException e) {
                LOG.error("Could not quarantine already processed import {}: {}", c.importPath(), e.toString());
            }
        }
        return pending;
    }

    private static void record(ProcessingOutcome outcome, Tally tally) {
        switch (outcome.status()) {
            case SUCCESS -> tally.succeeded++;
            case SKIPPED -> tally.skipped++;
            case FAILED -> tally.failed++;
        }
    }

    private static final class Tally {
        int discovered;
        int selected;
        int succeeded;
        int skipped;
        int failed;
        int feedErrors;
    }
}
