/**
 * Transcription engine abstraction.
 *
 * <p>{@link com.phillippitts.podscribe.service.stt.TranscriptionEngine} is the seam between the
 * pipeline and the external Whisper tools. The {@code whisper} subpackage holds the two CLI
 * adapters and the subprocess runner they share.
 */
package com.phillippitts.podscribe.service.stt;
