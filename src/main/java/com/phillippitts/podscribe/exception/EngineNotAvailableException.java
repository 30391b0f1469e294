package com.phillippitts.podscribe.exception;

/**
 * Thrown when the configured transcription engine binary cannot be found or executed.
 * This is a fatal error that prevents the pipeline from starting.
 */
public class EngineNotAvailableException extends PodscribeException {

    private final String binary;

    public EngineNotAvailableException(String binary) {
        super("Transcription engine binary not available: " + binary);
        this.binary = binary;
    }

    public EngineNotAvailableException(String binary, Throwable cause) {
        super("Transcription engine binary not available: " + binary, cause);
        this.binary = binary;
    }

    public String getBinary() {
        return binary;
    }
}
