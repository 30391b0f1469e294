/**
 * Whisper command line adapters.
 *
 * <p>Both engines run an external Python tool as a subprocess through
 * {@link com.phillippitts.podscribe.service.stt.whisper.WhisperCliRunner}, ask it for JSON output in
 * a private temp directory, and parse the segments with org.json.
 */
package com.phillippitts.podscribe.service.stt.whisper;
