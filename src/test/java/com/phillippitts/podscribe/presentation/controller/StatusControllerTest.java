package com.phillippitts.podscribe.presentation.controller;

import com.phillippitts.podscribe.config.properties.FeedProperties;
import com.phillippitts.podscribe.config.properties.ImportProperties;
import com.phillippitts.podscribe.domain.PassSummary;
import com.phillippitts.podscribe.service.scheduling.PassScheduler;
import com.phillippitts.podscribe.service.state.ProcessedEpisodeStore;
import com.phillippitts.podscribe.testutil.FakeTranscriptionEngine;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StatusControllerTest {

    @Test
    void reportsSchedulerSourcesAndLastPass() {
        PassScheduler scheduler = mock(PassScheduler.class);
        Instant t = Instant.parse("2024-05-08T12:00:00Z");
        when(scheduler.getState()).thenReturn(PassScheduler.State.SLEEPING);
        when(scheduler.getPassCount()).thenReturn(3L);
        when(scheduler.getLastSummary())
                .thenReturn(Optional.of(new PassSummary("abc", t, t.plusSeconds(65), 5, 2, 1, 0, 1, 0)));
        ProcessedEpisodeStore store = mock(ProcessedEpisodeStore.class);
        when(store.size()).thenReturn(7);
        FeedProperties feeds = new FeedProperties();
        feeds.setUrls("https://a.example/rss;https://b.example/rss");
        ImportProperties imports = new ImportProperties();

        ResponseEntity<Map<String, Object>> response = new StatusController(scheduler, store,
                new FakeTranscriptionEngine(), feeds, imports).status();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> body = response.getBody();
        assertThat(body)
                .containsEntry("state", "SLEEPING")
                .containsEntry("passes", 3L)
                .containsEntry("processedEpisodes", 7)
                .containsEntry("engine", "fake")
                .containsEntry("engineReady", false)
                .containsEntry("feeds", 2)
                .containsEntry("importEnabled", false);
        @SuppressWarnings("unchecked")
        Map<String, Object> lastPass = (Map<String, Object>) body.get("lastPass");
        assertThat(lastPass)
                .containsEntry("passId", "abc")
                .containsEntry("durationSeconds", 65L)
                .containsEntry("failed", 1);
    }

    @Test
    void omitsLastPassBeforeFirstRun() {
        PassScheduler scheduler = mock(PassScheduler.class);
        when(scheduler.getState()).thenReturn(PassScheduler.State.IDLE);
        when(scheduler.getLastSummary()).thenReturn(Optional.empty());

        Map<String, Object> body = new StatusController(scheduler, mock(ProcessedEpisodeStore.class),
                new FakeTranscriptionEngine(), new FeedProperties(), new ImportProperties()).status().getBody();

        assertThat(body).doesNotContainKey("lastPass").containsEntry("state", "IDLE");
    }
}
