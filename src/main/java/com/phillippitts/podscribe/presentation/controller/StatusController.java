package com.phillippitts.podscribe.presentation.controller;

import com.phillippitts.podscribe.config.properties.FeedProperties;
import com.phillippitts.podscribe.config.properties.ImportProperties;
import com.phillippitts.podscribe.domain.PassSummary;
import com.phillippitts.podscribe.service.scheduling.PassScheduler;
import com.phillippitts.podscribe.service.state.ProcessedEpisodeStore;
import com.phillippitts.podscribe.service.stt.TranscriptionEngine;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of the scheduler and the last pass.
 */
@RestController
class StatusController {

    private final PassScheduler scheduler;
    private final ProcessedEpisodeStore store;
    private final TranscriptionEngine engine;
    private final FeedProperties feeds;
    private final ImportProperties imports;

    StatusController(PassScheduler scheduler, ProcessedEpisodeStore store, TranscriptionEngine engine,
                     FeedProperties feeds, ImportProperties imports) {
        this.scheduler = scheduler;
        this.store = store;
        this.engine = engine;
        this.feeds = feeds;
        this.imports = imports;
    }

    @GetMapping("/status")
    ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("state", scheduler.getState().name());
        body.put("passInFlight", scheduler.isPassInFlight());
        body.put("passes", scheduler.getPassCount());
        body.put("processedEpisodes", store.size());
        body.put("engine", engine.getEngineName());
        body.put("engineReady", engine.isHealthy());
        body.put("feeds", feeds.urlList().size());
        body.put("importEnabled", imports.isEnabled());
        scheduler.getLastSummary().ifPresent(s -> body.put("lastPass", toMap(s)));
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> toMap(PassSummary s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("passId", s.passId());
        m.put("startedAt", s.startedAt().toString());
        m.put("finishedAt", s.finishedAt().toString());
        m.put("durationSeconds", s.duration().toSeconds());
        m.put("discovered", s.discovered());
        m.put("selected", s.selected());
        m.put("succeeded", s.succeeded());
        m.put("skipped", s.skipped());
        m.put("failed", s.failed());
        m.put("feedErrors", s.feedErrors());
        return m;
    }
}
