package com.phillippitts.podscribe.exception;

/**
 * A transcription engine could not turn an audio file into segments: the process failed, timed out,
 * ran out of memory, or left no readable result.
 *
 * <p>The message is suffixed with {@code (engine: <id>)} whenever the engine is known.
 */
public class TranscriptionException extends PodscribeException {

    static final String UNKNOWN_ENGINE = "unknown";

    private final String engineName;

    public TranscriptionException(String message) {
        super(message);
        this.engineName = UNKNOWN_ENGINE;
    }

    public TranscriptionException(String message, String engineName) {
        super(tagged(message, engineName));
        this.engineName = engineName;
    }

    public TranscriptionException(String message, String engineName, Throwable cause) {
        super(tagged(message, engineName), cause);
        this.engineName = engineName;
    }

    private static String tagged(String message, String engineName) {
        return message + " (engine: " + engineName + ")";
    }

    /** Engine id such as {@code faster-whisper}, or {@code unknown}. */
    public String getEngineName() {
        return engineName;
    }
}
