package com.phillippitts.podscribe.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link TranscriptionException} carrying engine process diagnostics.
 *
 * <p>Both CLI engines fail in the same handful of ways (non-zero exit, unreadable JSON,
 * missing output file), so they share one message layout:
 * <pre>
 * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (engine: {engine})
 * </pre>
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw TranscriptionExceptionBuilder.create("Non-zero exit")
 *         .engine("faster-whisper")
 *         .exitCode(1)
 *         .durationMs(81_000)
 *         .metadata("audio", audioPath)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class TranscriptionExceptionBuilder {

    private final String message;
    private String engineName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private TranscriptionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static TranscriptionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TranscriptionExceptionBuilder(message);
    }

    public TranscriptionExceptionBuilder engine(String engineName) {
        this.engineName = engineName;
        return this;
    }

    public TranscriptionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public TranscriptionExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public TranscriptionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the message. Null keys or values are skipped.
     */
    public TranscriptionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public TranscriptionException build() {
        String detailedMessage = buildDetailedMessage();
        String engine = engineName != null ? engineName : TranscriptionException.UNKNOWN_ENGINE;
        if (cause != null) {
            return new TranscriptionException(detailedMessage, engine, cause);
        }
        return new TranscriptionException(detailedMessage, engine);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (exitCode != null) {
            details.put("exitCode", String.valueOf(exitCode));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
