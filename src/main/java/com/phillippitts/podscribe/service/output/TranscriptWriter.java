package com.phillippitts.podscribe.service.output;

import com.phillippitts.podscribe.config.properties.OutputProperties;
import com.phillippitts.podscribe.domain.EpisodeCandidate;
import com.phillippitts.podscribe.domain.TranscriptionResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * Writes transcripts so that a file at its final path is always complete.
 *
 * <p>Content goes to {@code <name>.txt.<random>.partial}, is forced to disk, and is then renamed
 * atomically over the final path.
 *
 * <p>The final name is the sanitized title. If another episode already owns that name, the first
 * 8 hex characters of the identifier are appended. The chosen name is recorded in
 * {@code transcripts/.claims/<identifier>} before the rename, so a retry of the same episode after a
 * crash overwrites its own transcript instead of producing a suffixed second copy.
 */
@Component
public class TranscriptWriter {

    private static final Logger LOG = LogManager.getLogger(TranscriptWriter.class);

    public static final String CLAIMS_DIR_NAME = ".claims";
    public static final String PARTIAL_SUFFIX = ".partial";
    static final String TRANSCRIPT_EXTENSION = ".txt";

    private final Path transcriptsDir;
    private final Path claimsDir;

    @Autowired
    public TranscriptWriter(OutputProperties output) {
        this(output.transcriptsDir());
    }

    public TranscriptWriter(Path transcriptsDir) {
        this.transcriptsDir = transcriptsDir;
        this.claimsDir = transcriptsDir.resolve(CLAIMS_DIR_NAME);
    }

    /**
     * Writes the rendered transcript and returns its final path.
     *
     * @throws IOException if the transcript cannot be written; no partial file is left behind
     */
    public Path write(EpisodeCandidate candidate, TranscriptionResult result) throws IOException {
        Files.createDirectories(claimsDir);
        String name = resolveName(candidate);
        Path target = transcriptsDir.resolve(name);
        Path temp = transcriptsDir.resolve(name + "." + UUID.randomUUID().toString().substring(0, 8) + PARTIAL_SUFFIX);
        try {
            writeDurably(temp, result.render());
            moveAtomically(temp, target);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        LOG.info("Transcript written: {} ({} segments)", name, result.segments().size());
        return target;
    }

    /**
     * Drops the name claim once the episode is committed to the state store.
     */
    public void releaseClaim(String identifier) {
        try {
            Files.deleteIfExists(claimsDir.resolve(identifier));
        } catch (IOException e) {
            // A stale claim only pins a name for an already processed identifier
            LOG.debug("Could not remove claim {}: {}", identifier, e.toString());
        }
    }

    String resolveName(EpisodeCandidate candidate) throws IOException {
        Path claim = claimsDir.resolve(candidate.identifier());
        if (Files.isRegularFile(claim)) {
            String claimed = Files.readString(claim, StandardCharsets.UTF_8).strip();
            if (!claimed.isEmpty() && !claimed.contains("/")) {
                LOG.info("Reusing claimed transcript name {} for retry of {}", claimed, candidate.shortId());
                return claimed;
            }
        }

        String base = candidate.fileBaseName();
        String name = base + TRANSCRIPT_EXTENSION;
        if (Files.exists(transcriptsDir.resolve(name))) {
            name = base + "_" + candidate.shortId() + TRANSCRIPT_EXTENSION;
            for (int n = 2; Files.exists(transcriptsDir.resolve(name)); n++) {
                name = base + "_" + candidate.shortId() + "_" + n + TRANSCRIPT_EXTENSION;
            }
            LOG.info("Transcript name {}{} taken by another episode; using {}", base, TRANSCRIPT_EXTENSION, name);
        }

        Path claimTemp = claimsDir.resolve(candidate.identifier() + PARTIAL_SUFFIX);
        writeDurably(claimTemp, name);
        moveAtomically(claimTemp, claim);
        return name;
    }

    private static void writeDurably(Path file, String content) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            ByteBuffer buf = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
            while (buf.hasRemaining()) {
                channel.write(buf);
            }
            channel.force(true);
        }
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
