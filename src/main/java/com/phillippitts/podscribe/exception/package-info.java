/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend a common base so that the pipeline can contain
 * failures at the narrowest scope that preserves forward progress.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.podscribe.exception.PodscribeException} - Base exception</li>
 *   <li>{@link com.phillippitts.podscribe.exception.FeedFetchException},
 *       {@link com.phillippitts.podscribe.exception.FeedParseException} - feed-level, the feed is
 *       skipped for the pass</li>
 *   <li>{@link com.phillippitts.podscribe.exception.DownloadException},
 *       {@link com.phillippitts.podscribe.exception.TranscriptionException} - episode-level, the
 *       episode is retried on the next pass</li>
 *   <li>{@link com.phillippitts.podscribe.exception.NotificationException} - logged only</li>
 *   <li>{@link com.phillippitts.podscribe.exception.StateStoreException} - fatal</li>
 *   <li>{@link com.phillippitts.podscribe.exception.EngineNotAvailableException} - fatal at startup</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.podscribe.exception;
