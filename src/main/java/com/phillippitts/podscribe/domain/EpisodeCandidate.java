package com.phillippitts.podscribe.domain;

import com.phillippitts.podscribe.util.FileNames;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * One discovered unit of work: a feed episode or an imported audio file.
 *
 * <p>Candidates are recomputed on every pass. The {@code identifier} must be derived only from
 * data that is stable across restarts (feed URL + GUID, or file name + size + mtime), otherwise
 * the same episode would be transcribed twice.
 *
 * @param sourceKind    feed or import
 * @param identifier    stable de-duplication key (hex SHA-256)
 * @param title         human-readable title, unsanitized
 * @param audioLocation remote URL for feed episodes, absolute file path for imports
 * @param publishedAt   publish time for feed episodes; null for imports and undated entries
 * @param feedUrl       originating feed, null for imports
 * @param feedOrder     position of the feed in the configured list; -1 for imports
 * @param staged        true when an import was recovered from the staging directory
 */
public record EpisodeCandidate(
        SourceKind sourceKind,
        String identifier,
        String title,
        String audioLocation,
        Instant publishedAt,
        String feedUrl,
        int feedOrder,
        boolean staged
) {

    public EpisodeCandidate {
        Objects.requireNonNull(sourceKind, "sourceKind must not be null");
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(audioLocation, "audioLocation must not be null");
        if (identifier.isBlank()) {
            throw new IllegalArgumentException("identifier must not be blank");
        }
        if (title == null || title.isBlank()) {
            title = "episode_" + identifier.substring(0, Math.min(8, identifier.length()));
        }
    }

    public static EpisodeCandidate feed(String identifier, String title, String audioUrl,
                                        Instant publishedAt, String feedUrl, int feedOrder) {
        return new EpisodeCandidate(SourceKind.FEED, identifier, title, audioUrl, publishedAt,
                feedUrl, feedOrder, false);
    }

    public static EpisodeCandidate imported(String identifier, String title, Path file, boolean staged) {
        return new EpisodeCandidate(SourceKind.IMPORT, identifier, title,
                file.toAbsolutePath().toString(), null, null, -1, staged);
    }

    public boolean isImport() {
        return sourceKind == SourceKind.IMPORT;
    }

    /** Base name for output files, derived from the title. */
    public String fileBaseName() {
        return FileNames.sanitize(title);
    }

    /** Local path of an import candidate. */
    public Path importPath() {
        if (!isImport()) {
            throw new IllegalStateException("Not an import candidate: " + identifier);
        }
        return Path.of(audioLocation);
    }

    /** Short identifier prefix for log lines and filename suffixes. */
    public String shortId() {
        return identifier.substring(0, Math.min(8, identifier.length()));
    }
}
