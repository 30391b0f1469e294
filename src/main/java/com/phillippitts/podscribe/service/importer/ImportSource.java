package com.phillippitts.podscribe.service.importer;

import com.phillippitts.podscribe.config.properties.ImportProperties;
import com.phillippitts.podscribe.domain.EpisodeCandidate;
import com.phillippitts.podscribe.util.FileNames;
import com.phillippitts.podscribe.util.Hashing;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Watched import directory: discovery, claiming and disposal of locally dropped audio files.
 *
 * <p>Layout:
 * <pre>
 * &lt;import&gt;/episode.mp3            waiting to be picked up
 * &lt;import&gt;/.processing_tmp/        claimed, being processed (resumed after a crash)
 * &lt;import&gt;/.failed/                quarantined, never rescanned
 * </pre>
 *
 * <p>A claimed file keeps its name, size and modification time, so its identifier is the same
 * before and after the move. When no import directory is configured every operation is a no-op.
 */
@Component
public class ImportSource {

    private static final Logger LOG = LogManager.getLogger(ImportSource.class);

    private static final Comparator<ScannedFile> SCAN_ORDER = Comparator
            .comparingLong(ScannedFile::modifiedMillis)
            .thenComparing(f -> f.path().getFileName().toString());

    private final ImportProperties props;
    private final List<String> extensions;
    private final Map<String, Integer> failedAttempts = new ConcurrentHashMap<>();

    private record ScannedFile(Path path, long size, long modifiedMillis) {}

    public ImportSource(ImportProperties props) {
        this.props = props;
        this.extensions = props.normalizedExtensions();
    }

    public boolean isEnabled() {
        return props.isEnabled();
    }

    /**
     * Creates the import root when it is configured but missing.
     */
    public void prepareDirectories() {
        if (!isEnabled()) {
            return;
        }
        Path root = props.root();
        if (!Files.isDirectory(root)) {
            try {
                Files.createDirectories(root);
                LOG.info("Created import directory {}", root);
            } catch (IOException e) {
                LOG.warn("Import directory {} does not exist and could not be created: {}", root, e.toString());
            }
        }
    }

    /**
     * Lists importable files in the root, oldest first (file name breaks ties).
     * Hidden files, directories and files with other extensions are ignored.
     */
    public List<EpisodeCandidate> scan() {
        if (!isEnabled()) {
            return List.of();
        }
        Path root = props.root();
        if (!Files.isDirectory(root)) {
            LOG.warn("Import directory {} not found or not a directory; skipping", root);
            return List.of();
        }
        List<EpisodeCandidate> candidates = toCandidates(listAudio(root), false);
        if (!candidates.isEmpty()) {
            LOG.info("Found {} file(s) in import folder {}", candidates.size(), root);
        }
        return candidates;
    }

    /**
     * Returns files left in staging by an interrupted run, as staged candidates to be resumed.
     */
    public List<EpisodeCandidate> recoverStaged() {
        if (!isEnabled()) {
            return List.of();
        }
        Path staging = props.stagingDir();
        if (!Files.isDirectory(staging)) {
            return List.of();
        }
        List<EpisodeCandidate> residue = toCandidates(listAudio(staging), true);
        if (!residue.isEmpty()) {
            LOG.warn("Resuming {} staged import(s) left by an interrupted run", residue.size());
        }
        return residue;
    }

    /**
     * Atomically moves an import from the root into staging.
     *
     * @return path of the staged working file
     * @throws UncheckedIOException if the move fails (for example a same-named file is already staged)
     */
    public Path claim(EpisodeCandidate candidate) {
        Path source = candidate.importPath();
        if (candidate.staged()) {
            return source;
        }
        Path target = props.stagingDir().resolve(source.getFileName().toString());
        try {
            Files.createDirectories(props.stagingDir());
            moveAtomically(source, target);
            LOG.debug("Claimed import {} into staging", source.getFileName());
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot claim import " + source.getFileName(), e);
        }
    }

    /**
     * Returns a failed import to the root so the next pass retries it, or quarantines it once it has
     * failed {@code maxAttempts} times in this process.
     *
     * @return where the file ended up
     */
    public Path release(EpisodeCandidate candidate, Path stagedPath) {
        if (!Files.exists(stagedPath)) {
            LOG.warn("Staged import {} vanished before it could be released", stagedPath.getFileName());
            return stagedPath;
        }
        int attempts = failedAttempts.merge(candidate.identifier(), 1, Integer::sum);
        if (attempts >= props.getMaxAttempts()) {
            LOG.error("Import {} failed {} time(s); moving to quarantine", stagedPath.getFileName(), attempts);
            failedAttempts.remove(candidate.identifier());
            return quarantine(stagedPath);
        }
        Path target = props.root().resolve(stagedPath.getFileName().toString());
        try {
            moveAtomically(stagedPath, target);
            LOG.info("Released import {} back to import root (attempt {}/{})",
                    stagedPath.getFileName(), attempts, props.getMaxAttempts());
            return target;
        } catch (FileAlreadyExistsException e) {
            LOG.warn("A different {} already sits in the import root; quarantining the failed copy",
                    stagedPath.getFileName());
            return quarantine(stagedPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot release import " + stagedPath.getFileName(), e);
        }
    }

    /**
     * Moves a file into the quarantine directory, adding a counter to the name when needed.
     */
    public Path quarantine(Path file) {
        Path dir = props.quarantineDir();
        try {
            Files.createDirectories(dir);
            String name = file.getFileName().toString();
            Path target = dir.resolve(name);
            String stem = FileNames.stem(file);
            String ext = FileNames.extension(name);
            for (int n = 1; Files.exists(target, LinkOption.NOFOLLOW_LINKS); n++) {
                target = dir.resolve(stem + "." + n + ext);
            }
            moveAtomically(file, target);
            LOG.warn("Quarantined {} as {}", name, dir.relativize(target));
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot quarantine " + file.getFileName(), e);
        }
    }

    /** Failed attempts recorded for an identifier in this process. */
    int failedAttempts(String identifier) {
        return failedAttempts.getOrDefault(identifier, 0);
    }

    /**
     * Identifier of an import: hash of (file name, size, modification time in millis).
     */
    static String identifierFor(String fileName, long size, long modifiedMillis) {
        return Hashing.sha256Hex("import", fileName, Long.toString(size), Long.toString(modifiedMillis));
    }

    private List<ScannedFile> listAudio(Path dir) {
        List<ScannedFile> files = new ArrayList<>();
        try (Stream<Path> entries = Files.list(dir)) {
            entries.forEach(p -> {
                String name = p.getFileName().toString();
                if (name.startsWith(".") || !extensions.contains(FileNames.extension(name))) {
                    return;
                }
                try {
                    BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
                    if (attrs.isRegularFile()) {
                        files.add(new ScannedFile(p, attrs.size(), attrs.lastModifiedTime().toMillis()));
                    }
                } catch (IOException e) {
                    // Vanished between listing and stat; picked up next pass if it reappears
                    LOG.debug("Cannot stat {}: {}", p, e.toString());
                }
            });
        } catch (IOException e) {
            LOG.warn("Cannot list {}: {}", dir, e.toString());
            return List.of();
        }
        files.sort(SCAN_ORDER);
        return files;
    }

    private static List<EpisodeCandidate> toCandidates(List<ScannedFile> files, boolean staged) {
        List<EpisodeCandidate> candidates = new ArrayList<>(files.size());
        for (ScannedFile f : files) {
            String name = f.path().getFileName().toString();
            String id = identifierFor(name, f.size(), f.modifiedMillis());
            candidates.add(EpisodeCandidate.imported(id, FileNames.stem(f.path()), f.path(), staged));
        }
        return candidates;
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target);
        }
    }
}
