package com.phillippitts.podscribe.service.processing;

import com.phillippitts.podscribe.config.logging.PipelineLogContext;
import com.phillippitts.podscribe.config.properties.OutputProperties;
import com.phillippitts.podscribe.domain.EpisodeCandidate;
import com.phillippitts.podscribe.domain.FailureKind;
import com.phillippitts.podscribe.domain.ProcessingOutcome;
import com.phillippitts.podscribe.domain.TranscriptionResult;
import com.phillippitts.podscribe.exception.DownloadException;
import com.phillippitts.podscribe.exception.StateStoreException;
import com.phillippitts.podscribe.exception.TranscriptionException;
import com.phillippitts.podscribe.service.download.EpisodeDownloader;
import com.phillippitts.podscribe.service.importer.ImportSource;
import com.phillippitts.podscribe.service.notification.Notifier;
import com.phillippitts.podscribe.service.output.AudioRetention;
import com.phillippitts.podscribe.service.output.StartupCleanup;
import com.phillippitts.podscribe.service.output.TranscriptWriter;
import com.phillippitts.podscribe.service.processing.event.EpisodeFailedEvent;
import com.phillippitts.podscribe.service.processing.event.EpisodeProcessedEvent;
import com.phillippitts.podscribe.service.state.ProcessedEpisodeStore;
import com.phillippitts.podscribe.service.stt.TranscriptionEngine;
import com.phillippitts.podscribe.util.FileNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Runs one candidate through acquire, transcribe, emit, retain, notify and commit.
 *
 * <p>The identifier is committed last, after the transcript is durable; a failure at any earlier
 * step leaves the episode uncommitted so the next pass picks it up again. Every failure except
 * {@link StateStoreException} is contained here and reported as a {@link ProcessingOutcome}.
 *
 * <p>Working file disposition on failure: feed downloads are deleted; imports go back to the import
 * root (or quarantine after repeated failures).
 */
@Service
public class EpisodeProcessor {

    private static final Logger LOG = LogManager.getLogger(EpisodeProcessor.class);

    private static final String DEFAULT_AUDIO_EXTENSION = ".mp3";

    private final EpisodeDownloader downloader;
    private final ImportSource importSource;
    private final TranscriptionEngine engine;
    private final TranscriptWriter transcriptWriter;
    private final AudioRetention retention;
    private final Notifier notifier;
    private final ProcessedEpisodeStore store;
    private final OutputProperties output;
    private final ApplicationEventPublisher publisher;

    public EpisodeProcessor(EpisodeDownloader downloader,
                            ImportSource importSource,
                            TranscriptionEngine engine,
                            TranscriptWriter transcriptWriter,
                            AudioRetention retention,
                            Notifier notifier,
                            ProcessedEpisodeStore store,
                            OutputProperties output,
                            ApplicationEventPublisher publisher) {
        this.downloader = downloader;
        this.importSource = importSource;
        this.engine = engine;
        this.transcriptWriter = transcriptWriter;
        this.retention = retention;
        this.notifier = notifier;
        this.store = store;
        this.output = output;
        this.publisher = publisher;
    }

    /**
     * Processes one candidate.
     *
     * @throws StateStoreException if the commit cannot be persisted; the caller must stop
     */
    public ProcessingOutcome process(EpisodeCandidate candidate) {
        try (PipelineLogContext ignored = PipelineLogContext.forEpisode(candidate)) {
            LOG.info("Processing {} '{}'", candidate.sourceKind(), candidate.title());
            if (store.isProcessed(candidate.identifier())) {
                LOG.info("Already processed; skipping");
                return ProcessingOutcome.skipped(candidate, "already processed");
            }
            return runPipeline(candidate);
        }
    }

    private ProcessingOutcome runPipeline(EpisodeCandidate candidate) {
        long start = System.nanoTime();
        Path working = null;
        Stage stage = Stage.ACQUIRE;
        try {
            working = acquire(candidate);

            stage = Stage.TRANSCRIBE;
            LOG.info("Transcribing {} with {}", working.getFileName(), engine.getEngineName());
            long transcribeStart = System.nanoTime();
            TranscriptionResult result = engine.transcribe(working);
            Duration transcribeTime = Duration.ofNanos(System.nanoTime() - transcribeStart);

            stage = Stage.EMIT;
            Path transcript = transcriptWriter.write(candidate, result);

            stage = Stage.RETAIN;
            retention.apply(candidate, working);
            working = null;

            stage = Stage.NOTIFY;
            notifyQuietly(candidate, transcript);

            stage = Stage.COMMIT;
            store.markProcessed(candidate.identifier());
            transcriptWriter.releaseClaim(candidate.identifier());

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            LOG.info("Completed '{}' -> {} in {} s", candidate.title(), transcript.getFileName(),
                    elapsed.toSeconds());
            publisher.publishEvent(new EpisodeProcessedEvent(candidate.identifier(), candidate.sourceKind(),
                    transcript, result.segments().size(), elapsed, transcribeTime));
            return ProcessingOutcome.success(candidate, transcript.getFileName().toString());
        } catch (StateStoreException e) {
            throw e;
        } catch (Exception e) {
            FailureKind kind = classify(stage, e);
            LOG.error("Failed at {} stage ({}): {}", stage, kind, e.getMessage(), e);
            disposeOnFailure(candidate, working);
            publisher.publishEvent(new EpisodeFailedEvent(candidate.identifier(), candidate.sourceKind(), kind,
                    String.valueOf(e.getMessage())));
            return ProcessingOutcome.failed(candidate, kind, e);
        }
    }

    private Path acquire(EpisodeCandidate candidate) {
        if (candidate.isImport()) {
            Path staged = importSource.claim(candidate);
            LOG.info("Acquired import {}", staged.getFileName());
            return staged;
        }
        Path target = workingFileFor(candidate);
        LOG.info("Downloading {} to {}", candidate.audioLocation(), target.getFileName());
        downloader.download(candidate.audioLocation(), target);
        return target;
    }

    /**
     * {@code mp3/_temp_<base>.<ext>}, with the extension taken from the URL path (mp3 when absent).
     */
    Path workingFileFor(EpisodeCandidate candidate) {
        String ext = DEFAULT_AUDIO_EXTENSION;
        try {
            String path = URI.create(candidate.audioLocation()).getPath();
            String fromUrl = FileNames.extension(path);
            if (!fromUrl.isEmpty() && fromUrl.length() <= 6) {
                ext = fromUrl;
            }
        } catch (IllegalArgumentException e) {
            LOG.debug("Cannot parse audio URL {}: {}", candidate.audioLocation(), e.getMessage());
        }
        return output.audioDir().resolve(StartupCleanup.WORKING_FILE_PREFIX + candidate.fileBaseName() + ext);
    }

    private void notifyQuietly(EpisodeCandidate candidate, Path transcript) {
        try {
            notifier.notify(candidate.title(), transcript);
        } catch (RuntimeException e) {
            LOG.warn("Notification for '{}' failed: {}", candidate.title(), e.getMessage());
        }
    }

    private void disposeOnFailure(EpisodeCandidate candidate, Path working) {
        try {
            if (candidate.isImport()) {
                if (working != null) {
                    importSource.release(candidate, working);
                }
            } else {
                retention.discard(working);
            }
        } catch (RuntimeException e) {
            LOG.error("Could not dispose working file {} after failure: {}", working, e.toString());
        }
    }

    static FailureKind classify(Stage stage, Exception e) {
        if (e instanceof DownloadException) {
            return FailureKind.DOWNLOAD;
        }
        if (e instanceof TranscriptionException || stage == Stage.TRANSCRIBE) {
            return FailureKind.TRANSCRIPTION;
        }
        return FailureKind.UNKNOWN;
    }

    enum Stage { ACQUIRE, TRANSCRIBE, EMIT, RETAIN, NOTIFY, COMMIT }
}
