package com.phillippitts.podscribe.service.stt.whisper;

import com.phillippitts.podscribe.config.stt.TranscriptionEngineProperties;
import com.phillippitts.podscribe.domain.TranscriptionResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.phillippitts.podscribe.service.stt.whisper.WhisperTestDoubles.JsonWritingProcessFactory;
import static com.phillippitts.podscribe.service.stt.whisper.WhisperTestDoubles.ProcessBehavior;
import static com.phillippitts.podscribe.service.stt.whisper.WhisperTestDoubles.StubProcessFactory;
import static com.phillippitts.podscribe.service.stt.whisper.WhisperTestDoubles.TestProcess;
import static org.assertj.core.api.Assertions.assertThat;

class OpenAiWhisperEngineTest {

    @TempDir
    Path tmp;

    private static TranscriptionEngineProperties props(String device, String precision) {
        TranscriptionEngineProperties props = new TranscriptionEngineProperties();
        props.setType("openai-whisper");
        props.setOpenaiWhisperBinary("/bin/sh");
        props.setDevice(device);
        props.setPrecision(precision);
        return props;
    }

    @ParameterizedTest
    @CsvSource({
            "cpu, default, false",
            "cuda, default, true",
            "cuda:1, default, true",
            "cuda, float32, false",
            "cpu, float16, true",
            "cuda, int8, false"
    })
    void fp16FollowsPrecisionAndDevice(String device, String precision, boolean expected) {
        OpenAiWhisperEngine engine = new OpenAiWhisperEngine(props(device, precision), null,
                new StubProcessFactory(new TestProcess(ProcessBehavior.ok())));

        assertThat(engine.useFp16()).isEqualTo(expected);
    }

    @Test
    void commandUsesReferenceCliFlags() throws IOException {
        Path audio = Files.write(tmp.resolve("talk.m4a"), new byte[]{7});
        JsonWritingProcessFactory factory = new JsonWritingProcessFactory(new TestProcess(ProcessBehavior.ok()),
                "{\"language\":\"de\",\"segments\":[{\"start\":0,\"end\":1,\"text\":\"Hallo\"}]}");
        OpenAiWhisperEngine engine = new OpenAiWhisperEngine(props("cuda", "default"), null, factory);

        TranscriptionResult result = engine.transcribe(audio);

        String cmd = String.join(" ", factory.lastCommand);
        assertThat(cmd)
                .startsWith("/bin/sh " + audio.toAbsolutePath())
                .contains("--model base")
                .contains("--device cuda")
                .contains("--fp16 True")
                .contains("--output_format json")
                .doesNotContain("--compute_type")
                .doesNotContain("--beam_size");
        assertThat(result.engineName()).isEqualTo("openai-whisper");
        assertThat(result.language()).isEqualTo("de");
        assertThat(result.plainText()).isEqualTo("Hallo");
    }
}
