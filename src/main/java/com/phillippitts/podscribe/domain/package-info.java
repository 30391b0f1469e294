/**
 * Immutable domain model of the ingestion pipeline: candidates, transcription results,
 * processing outcomes and pass summaries.
 *
 * @since 1.0
 */
package com.phillippitts.podscribe.domain;
