package com.phillippitts.podscribe.config.properties;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Typed properties for the watched import directory.
 */
@Validated
@ConfigurationProperties(prefix = "podscribe.import")
public class ImportProperties {

    /** Name of the internal claim area inside the import directory. Not to be populated manually. */
    public static final String STAGING_DIR_NAME = ".processing_tmp";

    /** Name of the quarantine area for imports that keep failing or were already processed. */
    public static final String QUARANTINE_DIR_NAME = ".failed";

    /** Import root; blank disables the import source. */
    private String dir = "";

    /** Pass interval used when the import directory is the only configured source. */
    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration checkInterval = Duration.ofSeconds(60);

    @NotEmpty
    private List<String> extensions = new ArrayList<>(
            List.of("mp3", "wav", "m4a", "flac", "ogg", "aac", "opus"));

    /** Failed attempts (per process lifetime) before an import is moved to quarantine. */
    @Positive
    private int maxAttempts = 3;

    /** Re-scan the import directory before each feed episode so new imports jump the queue. */
    private boolean rescanBetweenEpisodes = true;

    public String getDir() {
        return dir;
    }

    public void setDir(String dir) {
        this.dir = dir;
    }

    public boolean isEnabled() {
        return dir != null && !dir.isBlank();
    }

    public Path root() {
        return Path.of(dir).toAbsolutePath().normalize();
    }

    public Path stagingDir() {
        return root().resolve(STAGING_DIR_NAME);
    }

    public Path quarantineDir() {
        return root().resolve(QUARANTINE_DIR_NAME);
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(Duration checkInterval) {
        this.checkInterval = checkInterval;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public void setExtensions(List<String> extensions) {
        this.extensions = extensions;
    }

    /**
     * Allow-listed extensions normalized to lower case with a leading dot (".mp3").
     */
    public List<String> normalizedExtensions() {
        return extensions.stream()
                .map(e -> e.trim().toLowerCase(Locale.ROOT))
                .filter(e -> !e.isEmpty())
                .map(e -> e.startsWith(".") ? e : "." + e)
                .toList();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public boolean isRescanBetweenEpisodes() {
        return rescanBetweenEpisodes;
    }

    public void setRescanBetweenEpisodes(boolean rescanBetweenEpisodes) {
        this.rescanBetweenEpisodes = rescanBetweenEpisodes;
    }
}
