package com.phillippitts.podscribe.util;

import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Filename helpers shared by the feed, import and output stages.
 */
public final class FileNames {

    /**
     * Longest sanitized base name kept, in UTF-8 bytes. File systems limit names to 255 bytes, and the
     * longest derived name ({@code <base>_<8 hex>.txt.<8 hex>.partial}) adds 30.
     */
    public static final int MAX_BASE_NAME_BYTES = 200;

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[\\\\/*?:\"<>|\\p{Cntrl}]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String FALLBACK_NAME = "episode";

    private FileNames() {
        // Utility class - prevent instantiation
    }

    /**
     * Turns a human-readable title into a safe file base name.
     *
     * <p>Path separators, wildcard and quoting characters are removed, whitespace runs become a
     * single underscore, and the result is capped at {@link #MAX_BASE_NAME_BYTES} UTF-8 bytes without
     * splitting a character.
     * Leading dots are stripped so that a title never produces a hidden file.
     *
     * @param title raw title (may be null)
     * @return sanitized, non-empty base name
     */
    public static String sanitize(String title) {
        if (title == null) {
            return FALLBACK_NAME;
        }
        String cleaned = UNSAFE_CHARS.matcher(title.strip()).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll("_");
        while (cleaned.startsWith(".")) {
            cleaned = cleaned.substring(1);
        }
        cleaned = truncateUtf8(cleaned, MAX_BASE_NAME_BYTES);
        return cleaned.isEmpty() ? FALLBACK_NAME : cleaned;
    }

    /** Longest prefix of {@code s} whose UTF-8 encoding fits in {@code maxBytes}, cut on a code point boundary. */
    static String truncateUtf8(String s, int maxBytes) {
        int bytes = 0;
        int end = 0;
        while (end < s.length()) {
            int cp = s.codePointAt(end);
            int size = utf8Length(cp);
            if (bytes + size > maxBytes) {
                break;
            }
            bytes += size;
            end += Character.charCount(cp);
        }
        return s.substring(0, end);
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        return codePoint < 0x10000 ? 3 : 4;
    }

    /**
     * Returns the lower-cased extension including the dot (".mp3"), or "" when there is none.
     */
    public static String extension(String fileName) {
        if (fileName == null) {
            return "";
        }
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        int dot = fileName.lastIndexOf('.');
        if (dot <= slash + 1 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the file name of a path without its extension.
     */
    public static String stem(Path path) {
        String name = path.getFileName().toString();
        String ext = extension(name);
        return ext.isEmpty() ? name : name.substring(0, name.length() - ext.length());
    }
}
