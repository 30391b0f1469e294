package com.phillippitts.podscribe.service.selection;

import com.phillippitts.podscribe.domain.EpisodeCandidate;
import com.phillippitts.podscribe.service.state.ProcessedEpisodeStore;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateSelectorTest {

    private static final Instant NOW = Instant.parse("2024-05-08T12:00:00Z");
    private static final Duration WEEK = Duration.ofDays(7);

    private final CandidateSelector selector = new CandidateSelector();

    /** In-memory store for selection tests. */
    private static final class MemoryStore implements ProcessedEpisodeStore {
        final Set<String> ids = new HashSet<>();

        @Override
        public boolean isProcessed(String identifier) {
            return ids.contains(identifier);
        }

        @Override
        public void markProcessed(String identifier) {
            ids.add(identifier);
        }

        @Override
        public int size() {
            return ids.size();
        }
    }

    private static EpisodeCandidate feed(String id, Instant publishedAt, int feedOrder) {
        return EpisodeCandidate.feed(id, "title " + id, "https://cdn.example/" + id + ".mp3", publishedAt,
                "https://feed" + feedOrder + ".example/rss", feedOrder);
    }

    private static EpisodeCandidate imported(String id) {
        return EpisodeCandidate.imported(id, id, Path.of("/import/" + id + ".mp3"), false);
    }

    @Test
    void lookbackBoundaryIsInclusive() {
        Instant cutoff = NOW.minus(WEEK);
        List<EpisodeCandidate> feeds = List.of(
                feed("at-cutoff", cutoff, 0),
                feed("just-before", cutoff.minusNanos(1), 0),
                feed("recent", NOW.minusSeconds(60), 0));

        List<EpisodeCandidate> selected = selector.select(feeds, List.of(), WEEK, new MemoryStore(), NOW);

        assertThat(selected).extracting(EpisodeCandidate::identifier).containsExactly("at-cutoff", "recent");
    }

    @Test
    void importsComeFirstRegardlessOfFeedDates() {
        List<EpisodeCandidate> feeds = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            feeds.add(feed("feed-" + i, NOW.minusSeconds(3600L * (i + 1)), 0));
        }

        List<EpisodeCandidate> selected = selector.select(feeds, List.of(imported("imp")), WEEK,
                new MemoryStore(), NOW);

        assertThat(selected).hasSize(11);
        assertThat(selected.get(0).identifier()).isEqualTo("imp");
    }

    @Test
    void importsBypassLookbackAndKeepGivenOrder() {
        List<EpisodeCandidate> imports = List.of(imported("second"), imported("first"));

        List<EpisodeCandidate> selected = selector.select(List.of(), imports, Duration.ZERO, new MemoryStore(), NOW);

        assertThat(selected).extracting(EpisodeCandidate::identifier).containsExactly("second", "first");
    }

    @Test
    void feedsOrderedByDateThenFeedOrderThenIdentifierWithUndatedLast() {
        Instant t = NOW.minus(Duration.ofDays(1));
        List<EpisodeCandidate> feeds = List.of(
                feed("undated", null, 0),
                feed("late", t.plusSeconds(10), 0),
                feed("b-same-time-feed1", t, 1),
                feed("z-same-time-feed0", t, 0),
                feed("a-same-time-feed0", t, 0));

        List<EpisodeCandidate> selected = selector.select(feeds, List.of(), WEEK, new MemoryStore(), NOW);

        assertThat(selected).extracting(EpisodeCandidate::identifier).containsExactly(
                "a-same-time-feed0", "z-same-time-feed0", "b-same-time-feed1", "late", "undated");
    }

    @Test
    void dropsProcessedAndDuplicateIdentifiers() {
        MemoryStore store = new MemoryStore();
        store.markProcessed("done");
        List<EpisodeCandidate> feeds = List.of(
                feed("done", NOW, 0),
                feed("shared", NOW.minusSeconds(5), 0),
                feed("shared", NOW.minusSeconds(1), 1));

        List<EpisodeCandidate> selected = selector.select(feeds, List.of(imported("done")), WEEK, store, NOW);

        assertThat(selected).hasSize(1);
        assertThat(selected.get(0).identifier()).isEqualTo("shared");
        assertThat(selected.get(0).feedOrder()).isZero();
    }

    @Test
    void emptyInputsGiveEmptyWorkList() {
        assertThat(selector.select(List.of(), List.of(), WEEK, new MemoryStore(), NOW)).isEmpty();
    }
}
