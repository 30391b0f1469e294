package com.phillippitts.podscribe.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Typed properties for the output root (bind-mounted in container deployments).
 *
 * <p>Layout under {@code dir}:
 * <pre>
 * .processed_episodes.log   append-only state
 * mp3/                      retained audio and in-flight working files
 * transcripts/              transcript text files
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "podscribe.output")
public class OutputProperties {

    public static final String STATE_FILE_NAME = ".processed_episodes.log";

    @NotBlank
    private String dir = "/out";

    /** Keep episode audio in {@code mp3/} after transcription instead of deleting it. */
    private boolean keepAudio = false;

    public String getDir() {
        return dir;
    }

    public void setDir(String dir) {
        this.dir = dir;
    }

    public boolean isKeepAudio() {
        return keepAudio;
    }

    public void setKeepAudio(boolean keepAudio) {
        this.keepAudio = keepAudio;
    }

    public Path root() {
        return Path.of(dir).toAbsolutePath().normalize();
    }

    public Path stateFile() {
        return root().resolve(STATE_FILE_NAME);
    }

    public Path audioDir() {
        return root().resolve("mp3");
    }

    public Path transcriptsDir() {
        return root().resolve("transcripts");
    }
}
