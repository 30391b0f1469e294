package com.phillippitts.podscribe.service.stt.whisper;

import com.phillippitts.podscribe.config.stt.TranscriptionEngineProperties;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Adapter for faster-whisper via the {@code whisper-ctranslate2} CLI.
 *
 * <p>CLI contract:
 * <pre>
 * whisper-ctranslate2 ${audio} --model ${model} --device ${device} --compute_type ${precision}
 *     --beam_size 5 --output_format json --output_dir ${tmp} --verbose True|False
 * </pre>
 */
public final class FasterWhisperEngine extends AbstractWhisperCliEngine {

    public static final String ENGINE_NAME = "faster-whisper";

    public FasterWhisperEngine(TranscriptionEngineProperties props, ApplicationEventPublisher publisher) {
        this(props, publisher, new DefaultProcessFactory());
    }

    FasterWhisperEngine(TranscriptionEngineProperties props, ApplicationEventPublisher publisher,
                        ProcessFactory processFactory) {
        super(props, publisher, processFactory, ENGINE_NAME);
    }

    @Override
    public String getEngineName() {
        return ENGINE_NAME;
    }

    @Override
    protected String binary() {
        return props.getFasterWhisperBinary();
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
        cmd.add("--compute_type");
        cmd.add(props.getPrecision());
        cmd.add("--beam_size");
        cmd.add(String.valueOf(WhisperConstants.FASTER_WHISPER_BEAM_SIZE));
        cmd.add("--output_format");
        cmd.add(WhisperConstants.OUTPUT_FORMAT);
        cmd.add("--output_dir");
        cmd.add(outputDir.toString());
        cmd.add("--verbose");
        cmd.add(pyBool(props.isVerbose()));
        return cmd;
    }
}
