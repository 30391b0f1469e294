package com.phillippitts.podscribe.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable result of transcribing one audio file.
 *
 * <p>Note: An empty segment list is valid (silence or music-only audio produces no speech).
 *
 * @param segments   timed segments in playback order
 * @param language   detected language code, or "unknown"
 * @param timestamp  when the transcription was completed
 * @param engineName engine that produced this result (e.g., "faster-whisper", "openai-whisper")
 */
public record TranscriptionResult(
        List<TranscriptSegment> segments,
        String language,
        Instant timestamp,
        String engineName
) {

    public TranscriptionResult {
        Objects.requireNonNull(segments, "Segments must not be null");
        segments = List.copyOf(segments);
        language = (language == null || language.isBlank()) ? "unknown" : language;
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        Objects.requireNonNull(engineName, "Engine name must not be null");
    }

    public static TranscriptionResult of(List<TranscriptSegment> segments, String language, String engineName) {
        return new TranscriptionResult(segments, language, Instant.now(), engineName);
    }

    /** Transcript file content: one rendered line per segment, newline terminated. */
    public String render() {
        if (segments.isEmpty()) {
            return "";
        }
        return segments.stream().map(TranscriptSegment::toLine).collect(Collectors.joining("\n", "", "\n"));
    }

    /** Plain text of all segments joined by spaces, for excerpts. */
    public String plainText() {
        return segments.stream().map(TranscriptSegment::text)
                .filter(t -> !t.isEmpty())
                .collect(Collectors.joining(" "));
    }
}
