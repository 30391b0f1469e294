package com.phillippitts.podscribe.exception;

/**
 * Root of the pipeline's unchecked failures.
 *
 * <p>Download, feed, transcription and notification errors are contained per episode or per feed;
 * {@link StateStoreException} is the one subtype that ends the run.
 */
public class PodscribeException extends RuntimeException {

    public PodscribeException(String message) {
        super(message);
    }

    public PodscribeException(String message, Throwable cause) {
        super(message, cause);
    }
}
