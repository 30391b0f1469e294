package com.phillippitts.podscribe.service.stt.whisper;

import com.phillippitts.podscribe.config.stt.TranscriptionEngineProperties;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Adapter for the reference openai-whisper {@code whisper} CLI.
 *
 * <p>The reference CLI has no compute type; precision maps onto {@code --fp16}:
 * "float16" enables it, any other explicit value disables it, and "default" enables it only on CUDA.
 */
public final class OpenAiWhisperEngine extends AbstractWhisperCliEngine {

    public static final String ENGINE_NAME = "openai-whisper";

    public OpenAiWhisperEngine(TranscriptionEngineProperties props, ApplicationEventPublisher publisher) {
        this(props, publisher, new DefaultProcessFactory());
    }

    OpenAiWhisperEngine(TranscriptionEngineProperties props, ApplicationEventPublisher publisher,
                        ProcessFactory processFactory) {
        super(props, publisher, processFactory, ENGINE_NAME);
    }

    @Override
    public String getEngineName() {
        return ENGINE_NAME;
    }

    @Override
    protected String binary() {
        return props.getOpenaiWhisperBinary();
    }

    @Override
    protected List<String> buildCommand(Path audio, Path outputDir) {
        List<String> cmd = new ArrayList<>();
        cmd.add(binary());
        cmd.add(audio.toString());
        cmd.add("--model");
        cmd.add(props.getModel());
        cmd.add("--device");
        cmd.add(props.getDevice());
        cmd.add("--fp16");
        cmd.add(pyBool(useFp16()));
        cmd.add("--output_format");
        cmd.add(WhisperConstants.OUTPUT_FORMAT);
        cmd.add("--output_dir");
        cmd.add(outputDir.toString());
        cmd.add("--verbose");
        cmd.add(pyBool(props.isVerbose()));
        return cmd;
    }

    boolean useFp16() {
        String precision = props.getPrecision().trim().toLowerCase(Locale.ROOT);
        if ("default".equals(precision)) {
            return props.getDevice().toLowerCase(Locale.ROOT).startsWith("cuda");
        }
        return "float16".equals(precision);
    }
}
