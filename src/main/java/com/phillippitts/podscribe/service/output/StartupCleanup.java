package com.phillippitts.podscribe.service.output;

import com.phillippitts.podscribe.config.properties.OutputProperties;
import com.phillippitts.podscribe.service.importer.ImportSource;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Prepares the output tree and removes leftovers of interrupted runs before the first pass.
 *
 * <p>Working downloads ({@code mp3/_temp_*}) and temp transcripts ({@code transcripts/*.partial}) are
 * never resumed; the episode is simply downloaded and transcribed again. Import staging residue is
 * not touched here; it is resumed by the pipeline.
 */
@Component
public class StartupCleanup {

    private static final Logger LOG = LogManager.getLogger(StartupCleanup.class);

    public static final String WORKING_FILE_PREFIX = "_temp_";

    private final OutputProperties output;
    private final ImportSource importSource;

    public StartupCleanup(OutputProperties output, ImportSource importSource) {
        this.output = output;
        this.importSource = importSource;
    }

    @PostConstruct
    void prepare() {
        try {
            Files.createDirectories(output.audioDir());
            Files.createDirectories(output.transcriptsDir().resolve(TranscriptWriter.CLAIMS_DIR_NAME));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directories under " + output.root(), e);
        }
        importSource.prepareDirectories();

        int removed = deleteMatching(output.audioDir(), WORKING_FILE_PREFIX + "*")
                + deleteMatching(output.transcriptsDir(), "*" + TranscriptWriter.PARTIAL_SUFFIX)
                + deleteMatching(output.transcriptsDir().resolve(TranscriptWriter.CLAIMS_DIR_NAME),
                "*" + TranscriptWriter.PARTIAL_SUFFIX);
        if (removed > 0) {
            LOG.warn("Removed {} leftover temp file(s) from an interrupted run", removed);
        }
        LOG.info("Output directory ready: {} (keepAudio={})", output.root(), output.isKeepAudio());
    }

    int deleteMatching(Path dir, String glob) {
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        int count = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p) && Files.deleteIfExists(p)) {
                    LOG.info("Deleted leftover {}", p);
                    count++;
                }
            }
        } catch (IOException e) {
            LOG.warn("Cleanup of {} in {} incomplete: {}", glob, dir, e.toString());
        }
        return count;
    }
}
