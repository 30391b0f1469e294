package com.phillippitts.podscribe.util;

import java.time.Duration;

/**
 * Standard timeout values for engine subprocess and stream-reader thread management.
 *
 * <p><b>Usage:</b> Used by {@link com.phillippitts.podscribe.service.stt.whisper.WhisperCliRunner}
 * when waiting for, or tearing down, a transcription subprocess.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream gobbler threads to flush buffered output after process completion.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for stream gobbler threads during cleanup (best-effort, daemon threads).
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     *
     * <p>Python based engines flush CUDA state on SIGTERM, so this is longer than a plain binary needs.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
