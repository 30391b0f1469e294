package com.phillippitts.podscribe.domain;

import com.phillippitts.podscribe.util.TimeUtils;

import java.util.Objects;

/**
 * One timed segment of a transcript.
 *
 * @param startSeconds segment start offset in seconds
 * @param endSeconds   segment end offset in seconds
 * @param text         segment text, trimmed
 */
public record TranscriptSegment(double startSeconds, double endSeconds, String text) {

    public TranscriptSegment {
        Objects.requireNonNull(text, "Segment text must not be null");
        if (startSeconds < 0 || endSeconds < startSeconds) {
            throw new IllegalArgumentException(
                    "Invalid segment bounds: start=" + startSeconds + ", end=" + endSeconds);
        }
        text = text.strip();
    }

    /** Renders the segment as {@code [HH:MM:SS.mmm --> HH:MM:SS.mmm] text}. */
    public String toLine() {
        return "[" + TimeUtils.formatTimestamp(startSeconds) + " --> "
                + TimeUtils.formatTimestamp(endSeconds) + "] " + text;
    }
}
