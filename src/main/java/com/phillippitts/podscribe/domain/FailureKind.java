package com.phillippitts.podscribe.domain;

/** Classification of an episode-level failure. All kinds are retried on the next pass. */
public enum FailureKind {
    DOWNLOAD,
    TRANSCRIPTION,
    UNKNOWN
}
