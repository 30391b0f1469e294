package com.phillippitts.podscribe.service.output;

import com.phillippitts.podscribe.config.properties.OutputProperties;
import com.phillippitts.podscribe.domain.EpisodeCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class AudioRetentionTest {

    @TempDir
    Path tmp;

    private OutputProperties output;
    private Path working;
    private final EpisodeCandidate episode = EpisodeCandidate.feed("abc123", "Big Talk",
            "https://cdn.example/big.m4a", null, "https://pod.example/rss", 0);

    @BeforeEach
    void setUp() throws IOException {
        output = new OutputProperties();
        output.setDir(tmp.toString());
        Files.createDirectories(output.audioDir());
        working = Files.writeString(output.audioDir().resolve("_temp_Big_Talk.m4a"), "audio");
    }

    @Test
    void deletesWorkingFileWhenRetentionDisabled() throws IOException {
        Optional<Path> kept = new AudioRetention(output).apply(episode, working);

        assertThat(kept).isEmpty();
        assertThat(working).doesNotExist();
    }

    @Test
    void movesWorkingFileIntoMp3DirWhenRetentionEnabled() throws IOException {
        output.setKeepAudio(true);

        Optional<Path> kept = new AudioRetention(output).apply(episode, working);

        assertThat(kept).contains(output.audioDir().resolve("Big_Talk.m4a"));
        assertThat(kept.get()).hasContent("audio");
        assertThat(working).doesNotExist();
    }

    @Test
    void retainedFileReplacesOlderCopy() throws IOException {
        output.setKeepAudio(true);
        Files.writeString(output.audioDir().resolve("Big_Talk.m4a"), "older");

        Path kept = new AudioRetention(output).apply(episode, working).orElseThrow();

        assertThat(kept).hasContent("audio");
    }

    @Test
    void retainsImportsFromOutsideTheOutputTree() throws IOException {
        output.setKeepAudio(true);
        Path staged = Files.writeString(Files.createDirectories(tmp.resolve("import/.processing_tmp"))
                .resolve("Dropped.flac"), "flac");
        EpisodeCandidate imported = EpisodeCandidate.imported("def456", "Dropped", staged, true);

        Path kept = new AudioRetention(output).apply(imported, staged).orElseThrow();

        assertThat(kept).isEqualTo(output.audioDir().resolve("Dropped.flac"));
        assertThat(staged).doesNotExist();
    }

    @Test
    void discardToleratesMissingAndNullFiles() {
        AudioRetention retention = new AudioRetention(output);

        retention.discard(working);
        retention.discard(working);
        retention.discard(null);

        assertThat(working).doesNotExist();
    }
}
