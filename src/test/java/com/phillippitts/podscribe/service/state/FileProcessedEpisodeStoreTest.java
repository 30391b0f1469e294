package com.phillippitts.podscribe.service.state;

import com.phillippitts.podscribe.exception.StateStoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileProcessedEpisodeStoreTest {

    @TempDir
    Path tmp;

    @Test
    void missingFileStartsEmpty() {
        FileProcessedEpisodeStore store = new FileProcessedEpisodeStore(tmp.resolve(".processed_episodes.log"));

        assertThat(store.size()).isZero();
        assertThat(store.isProcessed("abc")).isFalse();
        assertThat(store.isProcessed(null)).isFalse();
    }

    @Test
    void markedIdentifiersSurviveReload() {
        Path file = tmp.resolve("out/.processed_episodes.log");
        FileProcessedEpisodeStore store = new FileProcessedEpisodeStore(file);

        store.markProcessed("id-1");
        store.markProcessed("id-2");

        assertThat(store.isProcessed("id-1")).isTrue();
        FileProcessedEpisodeStore reloaded = new FileProcessedEpisodeStore(file);
        assertThat(reloaded.isProcessed("id-1")).isTrue();
        assertThat(reloaded.isProcessed("id-2")).isTrue();
        assertThat(reloaded.size()).isEqualTo(2);
    }

    @Test
    void appendsOneLinePerIdentifierAndNeverRewrites() throws IOException {
        Path file = tmp.resolve(".processed_episodes.log");
        Files.writeString(file, "old-1\n\n  \nold-2\nold-1\n", StandardCharsets.UTF_8);
        FileProcessedEpisodeStore store = new FileProcessedEpisodeStore(file);

        store.markProcessed("new-1");
        store.markProcessed("new-1");
        store.markProcessed("old-2");

        assertThat(store.size()).isEqualTo(3);
        assertThat(Files.readString(file, StandardCharsets.UTF_8))
                .isEqualTo("old-1\n\n  \nold-2\nold-1\nnew-1\n");
    }

    @Test
    void rejectsMultiLineIdentifiers() {
        FileProcessedEpisodeStore store = new FileProcessedEpisodeStore(tmp.resolve("state.log"));

        assertThatThrownBy(() -> store.markProcessed("a\nb")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.markProcessed(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void appendFailureIsStateStoreException() throws IOException {
        // A plain file where the log's parent directory should be makes every append fail
        Files.writeString(tmp.resolve("blocked"), "not a directory");
        FileProcessedEpisodeStore store = new FileProcessedEpisodeStore(tmp.resolve("blocked/state.log"));

        assertThatThrownBy(() -> store.markProcessed("id-1"))
                .isInstanceOf(StateStoreException.class)
                .hasMessageContaining("Cannot append");
        assertThat(store.isProcessed("id-1")).isFalse();
    }

    @Test
    void unreadableLogIsStateStoreException() throws IOException {
        Path dir = Files.createDirectories(tmp.resolve("state-as-dir.log"));

        assertThatThrownBy(() -> new FileProcessedEpisodeStore(dir))
                .isInstanceOf(StateStoreException.class)
                .hasMessageContaining("Cannot read state file");
    }
}
