package com.phillippitts.podscribe.exception;

/**
 * Thrown by notifiers when delivery fails. Always caught and logged by the caller.
 */
public class NotificationException extends PodscribeException {

    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
