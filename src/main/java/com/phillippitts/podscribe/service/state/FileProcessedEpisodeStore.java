package com.phillippitts.podscribe.service.state;

import com.phillippitts.podscribe.config.properties.OutputProperties;
import com.phillippitts.podscribe.exception.StateStoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only log of processed identifiers, one per line.
 *
 * <p>The whole log is read into memory at construction. Each {@link #markProcessed(String)} opens
 * the file in append mode, writes one line and forces it to disk before the identifier becomes
 * visible in memory. The file is never truncated or rewritten; blank lines and duplicates from
 * earlier runs are tolerated on load.
 */
@Component
public class FileProcessedEpisodeStore implements ProcessedEpisodeStore {

    private static final Logger LOG = LogManager.getLogger(FileProcessedEpisodeStore.class);

    private final Path stateFile;
    private final Set<String> processed = ConcurrentHashMap.newKeySet();
    private final Object appendLock = new Object();

    @Autowired
    public FileProcessedEpisodeStore(OutputProperties output) {
        this(output.stateFile());
    }

    public FileProcessedEpisodeStore(Path stateFile) {
        this.stateFile = Objects.requireNonNull(stateFile, "stateFile");
        load();
    }

    private void load() {
        if (!Files.exists(stateFile)) {
            LOG.info("No state file at {}; starting with empty history", stateFile);
            return;
        }
        int lines = 0;
        try (BufferedReader reader = Files.newBufferedReader(stateFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String id = line.strip();
                if (!id.isEmpty()) {
                    processed.add(id);
                    lines++;
                }
            }
        } catch (IOException e) {
            throw new StateStoreException("Cannot read state file", stateFile.toString(), e);
        }
        LOG.info("Loaded {} processed identifiers from {} ({} lines)", processed.size(), stateFile, lines);
    }

    @Override
    public boolean isProcessed(String identifier) {
        return identifier != null && processed.contains(identifier);
    }

    @Override
    public void markProcessed(String identifier) {
        Objects.requireNonNull(identifier, "identifier");
        if (identifier.isBlank() || identifier.contains("\n") || identifier.contains("\r")) {
            throw new IllegalArgumentException("identifier must be a single non-blank line");
        }
        synchronized (appendLock) {
            if (processed.contains(identifier)) {
                LOG.debug("Identifier {} already recorded", identifier);
                return;
            }
            try {
                Path parent = stateFile.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                try (FileChannel channel = FileChannel.open(stateFile,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                    ByteBuffer buf = ByteBuffer.wrap((identifier + "\n").getBytes(StandardCharsets.UTF_8));
                    while (buf.hasRemaining()) {
                        channel.write(buf);
                    }
                    channel.force(true);
                }
            } catch (IOException e) {
                throw new StateStoreException("Cannot append to state file", stateFile.toString(), e);
            }
            processed.add(identifier);
        }
        LOG.debug("Recorded {} in {}", identifier, stateFile.getFileName());
    }

    @Override
    public int size() {
        return processed.size();
    }
}
