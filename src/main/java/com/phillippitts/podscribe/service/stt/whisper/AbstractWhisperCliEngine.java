package com.phillippitts.podscribe.service.stt.whisper;

import com.phillippitts.podscribe.config.stt.TranscriptionEngineProperties;
import com.phillippitts.podscribe.domain.TranscriptSegment;
import com.phillippitts.podscribe.domain.TranscriptionResult;
import com.phillippitts.podscribe.exception.EngineNotAvailableException;
import com.phillippitts.podscribe.exception.TranscriptionException;
import com.phillippitts.podscribe.service.stt.AbstractTranscriptionEngine;
import com.phillippitts.podscribe.util.FileNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Shared flow of both Whisper CLI adapters: run the tool with JSON output into a private temp
 * directory, read the result file, parse segments, and clean up.
 *
 * <p>Subclasses only contribute the binary and the engine-specific command line flags.
 */
public abstract class AbstractWhisperCliEngine extends AbstractTranscriptionEngine {

    private static final Logger LOG = LogManager.getLogger(AbstractWhisperCliEngine.class);

    protected final TranscriptionEngineProperties props;
    private final ApplicationEventPublisher publisher;
    private final WhisperCliRunner runner;

    AbstractWhisperCliEngine(TranscriptionEngineProperties props,
                             ApplicationEventPublisher publisher,
                             ProcessFactory processFactory,
                             String engineName) {
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = publisher;
        this.runner = new WhisperCliRunner(processFactory, engineName, props.getMaxStdoutBytes());
    }

    /** Configured binary name or path. */
    protected abstract String binary();

    /**
     * Builds the full command line for one run.
     *
     * @param audio     absolute audio path
     * @param outputDir directory the tool must write its JSON result into
     */
    protected abstract List<String> buildCommand(Path audio, Path outputDir);

    @Override
    protected void doInitialize() {
        Path resolved = resolveExecutable(binary(), System.getenv("PATH"))
                .orElseThrow(() -> new EngineNotAvailableException(binary()));
        LOG.info("{} ready: binary={}, model={}, device={}, precision={}, timeout={}",
                getEngineName(), resolved, props.getModel(), props.getDevice(), props.getPrecision(),
                props.hasTimeout() ? props.getTimeout() : "none");
    }

    @Override
    protected void doClose() {
        runner.close();
        LOG.info("{} engine closed", getEngineName());
    }

    @Override
    public TranscriptionResult transcribe(Path audioPath) {
        if (audioPath == null || !Files.isRegularFile(audioPath)) {
            throw new IllegalArgumentException("audioPath must be an existing file: " + audioPath);
        }
        Path outputDir = null;
        try {
            initialize();
            ensureInitialized();
            outputDir = Files.createTempDirectory(WhisperConstants.OUTPUT_DIR_PREFIX);
            Path audio = audioPath.toAbsolutePath();

            WhisperCliRunner.CliResult run = runner.run(buildCommand(audio, outputDir), outputDir,
                    props.hasTimeout() ? props.getTimeout() : null);

            Path resultFile = locateResult(outputDir, audio);
            String json = Files.readString(resultFile, StandardCharsets.UTF_8);
            WhisperJsonParser.ParsedTranscript parsed = WhisperJsonParser.parse(json, getEngineName());

            if (LOG.isDebugEnabled()) {
                int n = 0;
                for (TranscriptSegment segment : parsed.segments()) {
                    LOG.debug("[{}] Segment {}: {}", getEngineName(), ++n, segment.toLine());
                }
            }
            LOG.info("[{}] Transcribed {}: {} segments, language={}, took {} ms",
                    getEngineName(), audio.getFileName(), parsed.segments().size(), parsed.language(),
                    run.durationMs());
            return TranscriptionResult.of(parsed.segments(), parsed.language(), getEngineName());
        } catch (Exception e) {
            throw handleTranscriptionError(e, publisher,
                    Map.of("audio", String.valueOf(audioPath.getFileName()), "model", props.getModel()));
        } finally {
            deleteQuietly(outputDir);
        }
    }

    private Path locateResult(Path outputDir, Path audio) throws IOException {
        Path expected = outputDir.resolve(FileNames.stem(audio) + "." + WhisperConstants.OUTPUT_FORMAT);
        if (Files.isRegularFile(expected)) {
            return expected;
        }
        // Some versions normalize the output name; take whatever JSON the run produced
        try (Stream<Path> files = Files.list(outputDir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".json"))
                    .findFirst()
                    .orElseThrow(() -> new TranscriptionException(
                            "Engine exited cleanly but wrote no JSON result to " + outputDir, getEngineName()));
        }
    }

    private void deleteQuietly(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            LOG.warn("Could not remove engine temp dir {}: {}", dir, e.toString());
        }
    }

    /**
     * Resolves a binary the way a shell would: paths containing a separator are checked directly,
     * bare names are searched on PATH.
     */
    static Optional<Path> resolveExecutable(String binary, String pathEnv) {
        if (binary == null || binary.isBlank()) {
            return Optional.empty();
        }
        if (binary.contains("/") || binary.contains(File.separator)) {
            Path p = Path.of(binary).toAbsolutePath();
            return Files.isRegularFile(p) && Files.isExecutable(p) ? Optional.of(p) : Optional.empty();
        }
        if (pathEnv == null || pathEnv.isBlank()) {
            return Optional.empty();
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir, binary);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /** Python CLIs parse boolean flags from "True"/"False". */
    static String pyBool(boolean value) {
        return value ? "True" : "False";
    }
}
