package com.phillippitts.podscribe.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExceptionHierarchyTest {

    @Test
    void podscribeExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        PodscribeException ex = new PodscribeException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void allDomainExceptionsAreUnchecked() {
        assertThat(new DownloadException("x", "u", 1)).isInstanceOf(PodscribeException.class);
        assertThat(new FeedFetchException("u", 500)).isInstanceOf(PodscribeException.class);
        assertThat(new FeedParseException("u", new IOException("bad"))).isInstanceOf(PodscribeException.class);
        assertThat(new NotificationException("x")).isInstanceOf(PodscribeException.class);
        assertThat(new StateStoreException("x", "f", new IOException())).isInstanceOf(PodscribeException.class);
        assertThat(new EngineNotAvailableException("whisper")).isInstanceOf(RuntimeException.class);
    }

    @Test
    void downloadExceptionShouldIncludeUrlAndAttempts() {
        DownloadException ex = new DownloadException("Download failed", "https://cdn.example/a.mp3", 3,
                new IOException("HTTP 404"));

        assertThat(ex.getMessage()).isEqualTo("Download failed (url=https://cdn.example/a.mp3, attempts=3)");
        assertThat(ex.getUrl()).isEqualTo("https://cdn.example/a.mp3");
        assertThat(ex.getAttempts()).isEqualTo(3);
    }

    @Test
    void feedFetchExceptionShouldCarryStatusOrMinusOne() {
        FeedFetchException http = new FeedFetchException("https://a.example/rss", 503);
        FeedFetchException network = new FeedFetchException("https://a.example/rss",
                new ConnectException("Connection refused"));

        assertThat(http.getMessage()).isEqualTo("Feed request failed with HTTP 503: https://a.example/rss");
        assertThat(http.getStatusCode()).isEqualTo(503);
        assertThat(network.getStatusCode()).isEqualTo(-1);
        assertThat(network.getMessage()).contains("Connection refused");
        assertThat(network.getFeedUrl()).isEqualTo("https://a.example/rss");
    }

    @Test
    void stateStoreExceptionShouldNameTheFile() {
        StateStoreException ex = new StateStoreException("Cannot append to state file", "/out/state.log",
                new IOException("disk full"));

        assertThat(ex.getMessage()).isEqualTo("Cannot append to state file: /out/state.log");
        assertThat(ex.getStateFile()).isEqualTo("/out/state.log");
    }

    @Test
    void transcriptionExceptionShouldIncludeEngineName() {
        TranscriptionException ex = new TranscriptionException("timeout occurred", "faster-whisper");

        assertThat(ex.getMessage()).isEqualTo("timeout occurred (engine: faster-whisper)");
        assertThat(ex.getEngineName()).isEqualTo("faster-whisper");
        assertThat(new TranscriptionException("plain").getEngineName()).isEqualTo("unknown");
    }

    @Test
    void engineNotAvailableExceptionShouldIncludeBinary() {
        EngineNotAvailableException ex = new EngineNotAvailableException("whisper-ctranslate2");

        assertThat(ex.getMessage()).contains("whisper-ctranslate2");
        assertThat(ex.getBinary()).isEqualTo("whisper-ctranslate2");
    }

    @Test
    void builderShouldLayOutProcessDiagnostics() {
        IOException cause = new IOException("broken pipe");

        TranscriptionException ex = TranscriptionExceptionBuilder.create("Non-zero exit")
                .engine("openai-whisper")
                .exitCode(2)
                .durationMs(1500)
                .metadata("audio", "ep.mp3")
                .metadata("ignored", null)
                .cause(cause)
                .build();

        assertThat(ex.getMessage())
                .isEqualTo("Non-zero exit (exitCode=2, durationMs=1500, audio=ep.mp3) (engine: openai-whisper)");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getEngineName()).isEqualTo("openai-whisper");
    }

    @Test
    void builderWithoutDetailsKeepsBareMessage() {
        TranscriptionException ex = TranscriptionExceptionBuilder.create("No output").build();

        assertThat(ex.getMessage()).isEqualTo("No output (engine: unknown)");
    }

    @Test
    void builderRejectsEmptyMessage() {
        assertThatThrownBy(() -> TranscriptionExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
