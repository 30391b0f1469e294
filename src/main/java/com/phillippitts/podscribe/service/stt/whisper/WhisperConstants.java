package com.phillippitts.podscribe.service.stt.whisper;

/**
 * Constants shared by the Whisper CLI adapters.
 *
 * @see WhisperCliRunner
 * @since 1.0
 */
final class WhisperConstants {

    /** Maximum bytes captured from stderr per run. Model download progress bars can be chatty. */
    static final int STDERR_MAX_BYTES = 256 * 1024;

    /** Characters of stderr tail included in exception messages. */
    static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    /** Beam size used by faster-whisper; matches the library default used by the CLI wrapper. */
    static final int FASTER_WHISPER_BEAM_SIZE = 5;

    /** Output format requested from both CLIs. */
    static final String OUTPUT_FORMAT = "json";

    /** Prefix of the per-run temp directory receiving the engine's JSON output. */
    static final String OUTPUT_DIR_PREFIX = "podscribe-whisper-";

    private WhisperConstants() {
        // Utility class - prevent instantiation
    }
}
