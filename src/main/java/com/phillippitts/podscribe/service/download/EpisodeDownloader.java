package com.phillippitts.podscribe.service.download;

import com.phillippitts.podscribe.config.properties.DownloadProperties;
import com.phillippitts.podscribe.exception.DownloadException;
import com.phillippitts.podscribe.util.HttpDeadlines;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.OptionalLong;

/**
 * Downloads episode audio to a working file.
 *
 * <p>Bytes are streamed to {@code <target>.part}; only a complete transfer (2xx status and, when the
 * server sent one, a byte count equal to Content-Length) is renamed to {@code <target>}. Failed
 * attempts are retried after a fixed backoff up to {@code podscribe.download.max-attempts}. Each attempt,
 * body included, must finish within {@code podscribe.download.transfer-timeout}.
 */
@Component
public class EpisodeDownloader {

    private static final Logger LOG = LogManager.getLogger(EpisodeDownloader.class);

    static final String PART_SUFFIX = ".part";

    /** Pause between attempts; replaced in tests. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final HttpClient httpClient;
    private final DownloadProperties props;
    private final Sleeper sleeper;

    @Autowired
    public EpisodeDownloader(HttpClient httpClient, DownloadProperties props) {
        this(httpClient, props, d -> Thread.sleep(d.toMillis()));
    }

    EpisodeDownloader(HttpClient httpClient, DownloadProperties props, Sleeper sleeper) {
        this.httpClient = httpClient;
        this.props = props;
        this.sleeper = sleeper;
    }

    /**
     * Downloads {@code url} to {@code target}, replacing any existing file.
     *
     * @return number of bytes written
     * @throws DownloadException when every attempt failed; no partial file is left behind
     */
    public long download(String url, Path target) {
        Path part = target.resolveSibling(target.getFileName() + PART_SUFFIX);
        int maxAttempts = Math.max(1, props.maxAttempts());
        Exception last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long start = System.nanoTime();
            try {
                long bytes = attempt(url, part);
                moveIntoPlace(part, target);
                LOG.info("Download complete: {} ({} bytes, {} ms, attempt {})", target.getFileName(), bytes,
                        Duration.ofNanos(System.nanoTime() - start).toMillis(), attempt);
                return bytes;
            } catch (IOException e) {
                last = e;
                deleteQuietly(part);
                LOG.warn("Download attempt {}/{} failed for {}: {}", attempt, maxAttempts, url, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                deleteQuietly(part);
                throw new DownloadException("Download interrupted", url, attempt, e);
            }
            if (attempt < maxAttempts) {
                try {
                    sleeper.sleep(props.retryBackoff());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new DownloadException("Download interrupted", url, attempt, e);
                }
            }
        }
        throw new DownloadException("Download failed", url, maxAttempts, last);
    }

    private long attempt(String url, Path part) throws IOException, InterruptedException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(props.requestTimeout())
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid audio URL: " + url, e);
        }
        LOG.debug("Downloading {} to {}", url, part.getFileName());
        Files.createDirectories(part.getParent());
        HttpResponse<Path> response = HttpDeadlines.await(
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofFile(part, StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)),
                props.transferTimeout());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("HTTP " + status);
        }
        long written = Files.size(part);
        OptionalLong expected = response.headers().firstValueAsLong("Content-Length");
        if (expected.isPresent() && expected.getAsLong() != written) {
            throw new IOException("Truncated transfer: expected " + expected.getAsLong()
                    + " bytes, got " + written);
        }
        if (written == 0) {
            throw new IOException("Empty response body");
        }
        return written;
    }

    private static void moveIntoPlace(Path part, Path target) throws IOException {
        try {
            Files.move(part, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not delete partial download {}: {}", file, e.toString());
        }
    }
}
