package com.phillippitts.podscribe.service.stt.whisper;

import com.phillippitts.podscribe.config.stt.TranscriptionEngineProperties;
import com.phillippitts.podscribe.domain.TranscriptionResult;
import com.phillippitts.podscribe.exception.EngineNotAvailableException;
import com.phillippitts.podscribe.exception.TranscriptionException;
import com.phillippitts.podscribe.service.stt.watchdog.EngineFailureEvent;
import com.phillippitts.podscribe.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.phillippitts.podscribe.service.stt.whisper.WhisperTestDoubles.JsonWritingProcessFactory;
import static com.phillippitts.podscribe.service.stt.whisper.WhisperTestDoubles.ProcessBehavior;
import static com.phillippitts.podscribe.service.stt.whisper.WhisperTestDoubles.StubProcessFactory;
import static com.phillippitts.podscribe.service.stt.whisper.WhisperTestDoubles.TestProcess;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FasterWhisperEngineTest {

    private static final String RESULT_JSON = """
            {"language": "en", "segments": [
              {"start": 0.0, "end": 3.2, "text": " Welcome to the show."},
              {"start": 3.2, "end": 7.0, "text": " Today we talk about Java."}
            ]}
            """;

    @TempDir
    Path tmp;

    private TranscriptionEngineProperties props;
    private EventCapturingPublisher publisher;
    private Path audio;

    @BeforeEach
    void setUp() throws IOException {
        props = new TranscriptionEngineProperties();
        // Any executable satisfies the binary check; the process itself is stubbed
        props.setFasterWhisperBinary("/bin/sh");
        props.setModel("small");
        props.setDevice("cuda");
        props.setPrecision("float16");
        publisher = new EventCapturingPublisher();
        audio = Files.write(tmp.resolve("episode 1.mp3"), new byte[]{1, 2, 3});
    }

    @Test
    void transcribeParsesJsonResultFile() {
        JsonWritingProcessFactory factory = new JsonWritingProcessFactory(
                new TestProcess(ProcessBehavior.ok()), RESULT_JSON);
        FasterWhisperEngine engine = new FasterWhisperEngine(props, publisher, factory);

        TranscriptionResult result = engine.transcribe(audio);

        assertThat(result.engineName()).isEqualTo("faster-whisper");
        assertThat(result.language()).isEqualTo("en");
        assertThat(result.segments()).hasSize(2);
        assertThat(result.render()).isEqualTo(
                "[00:00:00.000 --> 00:00:03.200] Welcome to the show.\n"
                        + "[00:00:03.200 --> 00:00:07.000] Today we talk about Java.\n");
        assertThat(engine.isHealthy()).isTrue();
    }

    @Test
    void commandCarriesStartupSettings() {
        JsonWritingProcessFactory factory = new JsonWritingProcessFactory(
                new TestProcess(ProcessBehavior.ok()), RESULT_JSON);
        FasterWhisperEngine engine = new FasterWhisperEngine(props, publisher, factory);

        engine.transcribe(audio);

        List<String> cmd = factory.lastCommand;
        assertThat(cmd.get(0)).isEqualTo("/bin/sh");
        assertThat(cmd.get(1)).isEqualTo(audio.toAbsolutePath().toString());
        assertThat(String.join(" ", cmd))
                .contains("--model small")
                .contains("--device cuda")
                .contains("--compute_type float16")
                .contains("--beam_size 5")
                .contains("--output_format json")
                .contains("--verbose False");
    }

    @Test
    void verboseFlagFollowsProperties() {
        props.setVerbose(true);
        JsonWritingProcessFactory factory = new JsonWritingProcessFactory(
                new TestProcess(ProcessBehavior.ok()), RESULT_JSON);
        FasterWhisperEngine engine = new FasterWhisperEngine(props, publisher, factory);

        engine.transcribe(audio);

        assertThat(String.join(" ", factory.lastCommand)).contains("--verbose True");
    }

    @Test
    void engineTempDirectoryIsRemovedAfterRun() {
        JsonWritingProcessFactory factory = new JsonWritingProcessFactory(
                new TestProcess(ProcessBehavior.ok()), RESULT_JSON);
        FasterWhisperEngine engine = new FasterWhisperEngine(props, publisher, factory);

        engine.transcribe(audio);

        List<String> cmd = factory.lastCommand;
        Path outputDir = Path.of(cmd.get(cmd.indexOf("--output_dir") + 1));
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void missingResultFileFailsAndPublishesEvent() {
        FasterWhisperEngine engine = new FasterWhisperEngine(props, publisher,
                new StubProcessFactory(new TestProcess(ProcessBehavior.ok())));

        assertThatThrownBy(() -> engine.transcribe(audio))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("wrote no JSON result");

        List<EngineFailureEvent> events = publisher.eventsOfType(EngineFailureEvent.class);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).engine()).isEqualTo("faster-whisper");
        assertThat(events.get(0).context()).containsEntry("audio", "episode 1.mp3").containsEntry("model", "small");
    }

    @Test
    void nonZeroExitFails() {
        FasterWhisperEngine engine = new FasterWhisperEngine(props, publisher,
                new StubProcessFactory(new TestProcess(new ProcessBehavior("", "model not found", 2, 0))));

        assertThatThrownBy(() -> engine.transcribe(audio))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("Non-zero exit: 2")
                .hasMessageContaining("model not found");
    }

    @Test
    void malformedResultFails() {
        FasterWhisperEngine engine = new FasterWhisperEngine(props, publisher,
                new JsonWritingProcessFactory(new TestProcess(ProcessBehavior.ok()), "{not json"));

        assertThatThrownBy(() -> engine.transcribe(audio))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    void missingAudioIsRejected() {
        FasterWhisperEngine engine = new FasterWhisperEngine(props, publisher,
                new StubProcessFactory(new TestProcess(ProcessBehavior.ok())));

        assertThatThrownBy(() -> engine.transcribe(tmp.resolve("nope.mp3")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void initializeFailsWhenBinaryIsMissing() {
        props.setFasterWhisperBinary(tmp.resolve("bin/whisper-ctranslate2").toString());
        FasterWhisperEngine engine = new FasterWhisperEngine(props, publisher,
                new StubProcessFactory(new TestProcess(ProcessBehavior.ok())));

        assertThatThrownBy(engine::initialize)
                .isInstanceOf(EngineNotAvailableException.class)
                .hasMessageContaining("whisper-ctranslate2");
        assertThat(engine.isHealthy()).isFalse();
    }

    @Test
    void closedEngineRefusesWork() {
        FasterWhisperEngine engine = new FasterWhisperEngine(props, publisher,
                new JsonWritingProcessFactory(new TestProcess(ProcessBehavior.ok()), RESULT_JSON));
        engine.initialize();
        engine.close();
        engine.close();

        assertThat(engine.isHealthy()).isFalse();
        assertThatThrownBy(() -> engine.transcribe(audio))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("not initialized or closed");
    }

    @Test
    void resolveExecutableSearchesPath() {
        String path = "/nonexistent" + File.pathSeparator + "/bin";

        assertThat(AbstractWhisperCliEngine.resolveExecutable("sh", path)).contains(Path.of("/bin", "sh"));
        assertThat(AbstractWhisperCliEngine.resolveExecutable("sh", "/nonexistent")).isEmpty();
        assertThat(AbstractWhisperCliEngine.resolveExecutable("sh", null)).isEmpty();
        assertThat(AbstractWhisperCliEngine.resolveExecutable(" ", path)).isEmpty();
        assertThat(AbstractWhisperCliEngine.resolveExecutable("/bin/sh", null)).isPresent();
    }
}
