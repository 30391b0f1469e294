/**
 * Transcription engine configuration and startup validation.
 */
package com.phillippitts.podscribe.config.stt;
