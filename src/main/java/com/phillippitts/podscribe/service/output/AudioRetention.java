package com.phillippitts.podscribe.service.output;

import com.phillippitts.podscribe.config.properties.OutputProperties;
import com.phillippitts.podscribe.domain.EpisodeCandidate;
import com.phillippitts.podscribe.util.FileNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps or discards the working audio of a transcribed episode.
 *
 * <p>With {@code podscribe.output.keep-audio=true} the file is moved to {@code mp3/<name>.<ext>},
 * replacing an older copy; otherwise it is deleted.
 */
@Component
public class AudioRetention {

    private static final Logger LOG = LogManager.getLogger(AudioRetention.class);

    private final OutputProperties output;

    public AudioRetention(OutputProperties output) {
        this.output = output;
    }

    /**
     * @return the retained path, or empty when the audio was deleted
     * @throws IOException if the file can be neither moved nor deleted
     */
    public Optional<Path> apply(EpisodeCandidate candidate, Path workingFile) throws IOException {
        if (!output.isKeepAudio()) {
            Files.deleteIfExists(workingFile);
            LOG.debug("Deleted working audio {}", workingFile.getFileName());
            return Optional.empty();
        }
        Path dir = output.audioDir();
        Files.createDirectories(dir);
        Path target = dir.resolve(candidate.fileBaseName() + FileNames.extension(workingFile.getFileName().toString()));
        try {
            Files.move(workingFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            // Import staging can live on a different filesystem than the output mount
            Files.move(workingFile, target, StandardCopyOption.REPLACE_EXISTING);
        }
        LOG.info("Kept audio as {}", dir.relativize(target));
        return Optional.of(target);
    }

    /**
     * Deletes a working file on a failure path. Never throws.
     */
    public void discard(Path workingFile) {
        if (workingFile == null) {
            return;
        }
        try {
            if (Files.deleteIfExists(workingFile)) {
                LOG.debug("Discarded working audio {}", workingFile.getFileName());
            }
        } catch (IOException e) {
            LOG.warn("Could not delete working audio {}: {}", workingFile, e.toString());
        }
    }
}
