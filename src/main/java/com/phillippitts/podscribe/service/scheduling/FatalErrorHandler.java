package com.phillippitts.podscribe.service.scheduling;

/**
 * Reaction to errors the pipeline cannot continue after.
 */
@FunctionalInterface
public interface FatalErrorHandler {

    void onFatalError(Throwable error);
}
