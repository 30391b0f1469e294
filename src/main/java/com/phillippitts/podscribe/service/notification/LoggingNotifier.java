package com.phillippitts.podscribe.service.notification;

import com.phillippitts.podscribe.exception.NotificationException;
import com.phillippitts.podscribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Log-only notifier used when no webhook is configured.
 *
 * <p>The transcript excerpt is only logged at DEBUG; INFO carries the title and file name.
 */
public class LoggingNotifier implements Notifier {

    private static final Logger LOG = LogManager.getLogger(LoggingNotifier.class);

    private final int excerptChars;

    public LoggingNotifier(int excerptChars) {
        this.excerptChars = excerptChars;
    }

    @Override
    public void notify(String title, Path transcriptPath) {
        if (!Files.isRegularFile(transcriptPath)) {
            throw new NotificationException("Transcript not found: " + transcriptPath);
        }
        LOG.info("Transcription complete for: {} -> {}", title, transcriptPath.getFileName());
        if (LOG.isDebugEnabled()) {
            LOG.debug("Excerpt: {}", LogSanitizer.excerpt(readHead(transcriptPath), excerptChars));
        }
    }

    // reads one extra char so the excerpt can tell whether it was cut
    private String readHead(Path transcriptPath) {
        char[] buf = new char[Math.max(excerptChars, 0) + 1];
        try (Reader reader = Files.newBufferedReader(transcriptPath, StandardCharsets.UTF_8)) {
            int n = reader.read(buf);
            return n <= 0 ? "" : new String(buf, 0, n);
        } catch (IOException e) {
            throw new NotificationException("Cannot read transcript " + transcriptPath.getFileName(), e);
        }
    }
}
