package com.phillippitts.podscribe.exception;

/**
 * Thrown when an RSS feed cannot be retrieved (network error, timeout, non-2xx status).
 * Feed-level: the feed is skipped for the current pass and retried on the next one.
 */
public class FeedFetchException extends PodscribeException {

    private final String feedUrl;
    private final int statusCode;

    public FeedFetchException(String feedUrl, int statusCode) {
        super("Feed request failed with HTTP " + statusCode + ": " + feedUrl);
        this.feedUrl = feedUrl;
        this.statusCode = statusCode;
    }

    public FeedFetchException(String feedUrl, Throwable cause) {
        super("Feed request failed: " + feedUrl + " (" + cause.getMessage() + ")", cause);
        this.feedUrl = feedUrl;
        this.statusCode = -1;
    }

    public String getFeedUrl() {
        return feedUrl;
    }

    /** @return HTTP status, or -1 when no response was received */
    public int getStatusCode() {
        return statusCode;
    }
}
