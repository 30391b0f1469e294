package com.phillippitts.podscribe.exception;

/**
 * Thrown when episode audio cannot be downloaded completely.
 * Covers network errors, non-2xx responses and truncated transfers.
 */
public class DownloadException extends PodscribeException {

    private final String url;
    private final int attempts;

    public DownloadException(String message, String url, int attempts) {
        super(message + " (url=" + url + ", attempts=" + attempts + ")");
        this.url = url;
        this.attempts = attempts;
    }

    public DownloadException(String message, String url, int attempts, Throwable cause) {
        super(message + " (url=" + url + ", attempts=" + attempts + ")", cause);
        this.url = url;
        this.attempts = attempts;
    }

    public String getUrl() {
        return url;
    }

    public int getAttempts() {
        return attempts;
    }
}
