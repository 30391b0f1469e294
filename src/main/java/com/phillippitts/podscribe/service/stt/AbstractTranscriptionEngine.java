package com.phillippitts.podscribe.service.stt;

import com.phillippitts.podscribe.exception.TranscriptionException;
import com.phillippitts.podscribe.service.stt.util.EngineEventPublisher;
import jakarta.annotation.PreDestroy;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Map;

/**
 * Base class for engine implementations providing common lifecycle and state management.
 *
 * <p>Template Method: {@link #initialize()} and {@link #close()} are idempotent, synchronized
 * wrappers around {@link #doInitialize()} and {@link #doClose()}.
 *
 * <p><b>Lifecycle:</b> uninitialized, then initialized, then closed. A closed engine is not reopened.
 *
 * @see TranscriptionEngine
 * @see com.phillippitts.podscribe.service.stt.whisper.FasterWhisperEngine
 * @see com.phillippitts.podscribe.service.stt.whisper.OpenAiWhisperEngine
 */
public abstract class AbstractTranscriptionEngine implements TranscriptionEngine {

    /** Guards {@link #initialized} and {@link #closed}. */
    protected final Object lock = new Object();

    protected boolean initialized = false;

    protected boolean closed = false;

    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized || closed) {
                return;
            }
            doInitialize();
            initialized = true;
        }
    }

    /**
     * Engine-specific initialization, called within the lock.
     *
     * @throws com.phillippitts.podscribe.exception.EngineNotAvailableException if the engine cannot run
     */
    protected abstract void doInitialize();

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    /**
     * Closes the engine. Invoked by the Spring container on shutdown.
     */
    @Override
    @PreDestroy
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            doClose();
            closed = true;
            initialized = false;
        }
    }

    /**
     * Engine-specific cleanup. Must not throw; log instead.
     */
    protected abstract void doClose();

    /**
     * @throws TranscriptionException if the engine is not initialized or already closed
     */
    protected final void ensureInitialized() {
        synchronized (lock) {
            if (!initialized || closed) {
                throw new TranscriptionException(
                        getEngineName() + " engine not initialized or closed",
                        getEngineName()
                );
            }
        }
    }

    /**
     * Publishes a failure event and rethrows the error as a {@link TranscriptionException}.
     *
     * <p><b>Usage Pattern:</b>
     * <pre>{@code
     * try {
     *     return runEngine(audio);
     * } catch (Exception e) {
     *     throw handleTranscriptionError(e, publisher, Map.of("audio", name));
     * }
     * }</pre>
     *
     * @return never returns normally; declared for use in a {@code throw} statement
     */
    protected final TranscriptionException handleTranscriptionError(
            Exception exception,
            ApplicationEventPublisher publisher,
            Map<String, String> context) {

        EngineEventPublisher.publishFailure(
                publisher,
                getEngineName(),
                "transcription failure",
                exception,
                context
        );

        if (exception instanceof TranscriptionException te) {
            throw te;
        }

        throw new TranscriptionException(
                getEngineName() + " transcription failed: " + exception.getMessage(),
                getEngineName(),
                exception
        );
    }
}
