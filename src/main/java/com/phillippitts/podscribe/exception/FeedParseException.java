package com.phillippitts.podscribe.exception;

/**
 * Thrown when a feed was retrieved but its content is not a parseable RSS/Atom document.
 */
public class FeedParseException extends PodscribeException {

    private final String feedUrl;

    public FeedParseException(String feedUrl, Throwable cause) {
        super("Feed content could not be parsed: " + feedUrl + " (" + cause.getMessage() + ")", cause);
        this.feedUrl = feedUrl;
    }

    public String getFeedUrl() {
        return feedUrl;
    }
}
