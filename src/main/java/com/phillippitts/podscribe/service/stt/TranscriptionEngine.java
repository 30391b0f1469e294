package com.phillippitts.podscribe.service.stt;

import com.phillippitts.podscribe.domain.TranscriptionResult;
import com.phillippitts.podscribe.exception.EngineNotAvailableException;
import com.phillippitts.podscribe.exception.TranscriptionException;

import java.nio.file.Path;

/**
 * Contract for transcription engine implementations.
 *
 * <p>Each implementation adapts one external Whisper command line tool behind a unified
 * interface. Exactly one engine is active per process, chosen at startup from
 * {@code podscribe.engine.type}.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Engine is constructed with the startup configuration (model, device, precision)</li>
 *   <li>{@link #initialize()} verifies the engine can run (may throw {@link EngineNotAvailableException})</li>
 *   <li>{@link #transcribe(Path)} processes one audio file (may throw {@link TranscriptionException})</li>
 *   <li>{@link #close()} terminates any running engine process</li>
 * </ol>
 *
 * <p>Thread Safety: the pipeline calls {@link #transcribe(Path)} from a single worker thread.
 * Implementations need not support concurrent transcriptions.
 *
 * @see com.phillippitts.podscribe.domain.TranscriptionResult
 */
public interface TranscriptionEngine extends AutoCloseable {

    /**
     * Prepares the engine. Called once at startup.
     *
     * @throws EngineNotAvailableException if the engine binary cannot be found
     */
    void initialize();

    /**
     * Transcribes the given audio file.
     *
     * <p>Any container format the engine understands is accepted (mp3, m4a, wav, ...).
     * No timeout applies unless one is configured.
     *
     * @param audioPath readable audio file
     * @return timed segments and detected language
     * @throws TranscriptionException if the engine fails or its output cannot be read
     * @throws IllegalArgumentException if audioPath is null or not a regular file
     */
    TranscriptionResult transcribe(Path audioPath);

    /**
     * Returns the engine name for logging and monitoring ("faster-whisper", "openai-whisper").
     */
    String getEngineName();

    /**
     * Returns true once {@link #initialize()} has succeeded and {@link #close()} has not been called.
     */
    boolean isHealthy();

    @Override
    void close();
}
