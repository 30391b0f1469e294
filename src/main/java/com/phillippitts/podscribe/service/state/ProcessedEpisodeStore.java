package com.phillippitts.podscribe.service.state;

import com.phillippitts.podscribe.exception.StateStoreException;

/**
 * Durable record of fully processed episode identifiers.
 *
 * <p>An identifier is recorded only after its transcript is durable on disk, so a positive
 * {@link #isProcessed(String)} is never a false claim. A crash before {@link #markProcessed(String)}
 * simply leaves the episode eligible for the next pass.
 */
public interface ProcessedEpisodeStore {

    boolean isProcessed(String identifier);

    /**
     * Durably records the identifier.
     *
     * @throws StateStoreException if the record cannot be persisted; callers treat this as fatal
     */
    void markProcessed(String identifier);

    /** Number of distinct processed identifiers. */
    int size();
}
