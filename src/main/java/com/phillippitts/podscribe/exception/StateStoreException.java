package com.phillippitts.podscribe.exception;

/**
 * Thrown when the processed-episode log cannot be read or appended to.
 *
 * <p>Unlike every other pipeline error this one is not contained: continuing without durable
 * state would cause duplicate work, so it aborts the pass and stops the application.
 */
public class StateStoreException extends PodscribeException {

    private final String stateFile;

    public StateStoreException(String message, String stateFile, Throwable cause) {
        super(message + ": " + stateFile, cause);
        this.stateFile = stateFile;
    }

    public String getStateFile() {
        return stateFile;
    }
}
