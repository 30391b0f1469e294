package com.phillippitts.podscribe.config.stt;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Startup configuration shared by both transcription engines.
 *
 * <p>Example application.properties:
 * <pre>
 * podscribe.engine.type=faster-whisper
 * podscribe.engine.model=base
 * podscribe.engine.device=cuda
 * podscribe.engine.precision=float16
 * podscribe.engine.timeout=0
 * </pre>
 *
 * <p>The engine type is fixed for the lifetime of the process; the matching engine bean is
 * chosen once by {@link TranscriptionEngineConfig}.
 */
@Validated
@ConfigurationProperties(prefix = "podscribe.engine")
public class TranscriptionEngineProperties {

    /** Engine variant, matched against the {@code podscribe.engine.type} property value. */
    public enum EngineType {
        FASTER_WHISPER("faster-whisper"),
        OPENAI_WHISPER("openai-whisper");

        private final String id;

        EngineType(String id) {
            this.id = id;
        }

        public String id() {
            return id;
        }

        /**
         * Resolves the property form ("faster-whisper"), ignoring case only. This is the same match the
         * conditional engine beans apply, so a value accepted here always selects an engine.
         */
        public static EngineType fromId(String value) {
            for (EngineType type : values()) {
                if (type.id.equalsIgnoreCase(value)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown transcription engine: '" + value
                    + "' (expected faster-whisper or openai-whisper)");
        }
    }

    @NotBlank
    private String type = EngineType.FASTER_WHISPER.id();

    @NotBlank
    private String model = "base";

    @NotBlank
    private String device = "cpu";

    /** faster-whisper compute type (int8, float16, ...) or "default". */
    @NotBlank
    private String precision = "default";

    /** Pass verbose progress output through to the engine. */
    private boolean verbose = false;

    @NotBlank
    private String fasterWhisperBinary = "whisper-ctranslate2";

    @NotBlank
    private String openaiWhisperBinary = "whisper";

    /** Per-episode transcription timeout; zero disables it. */
    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration timeout = Duration.ZERO;

    /** Cap on captured stdout per run; the JSON result is read from a file, not stdout. */
    private int maxStdoutBytes = 1024 * 1024;

    public EngineType engineType() {
        return EngineType.fromId(type);
    }

    public boolean hasTimeout() {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getDevice() {
        return device;
    }

    public void setDevice(String device) {
        this.device = device;
    }

    public String getPrecision() {
        return precision;
    }

    public void setPrecision(String precision) {
        this.precision = precision;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public String getFasterWhisperBinary() {
        return fasterWhisperBinary;
    }

    public void setFasterWhisperBinary(String fasterWhisperBinary) {
        this.fasterWhisperBinary = fasterWhisperBinary;
    }

    public String getOpenaiWhisperBinary() {
        return openaiWhisperBinary;
    }

    public void setOpenaiWhisperBinary(String openaiWhisperBinary) {
        this.openaiWhisperBinary = openaiWhisperBinary;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getMaxStdoutBytes() {
        return maxStdoutBytes;
    }

    public void setMaxStdoutBytes(int maxStdoutBytes) {
        this.maxStdoutBytes = maxStdoutBytes;
    }
}
