package com.phillippitts.podscribe.domain;

/** Where a candidate episode was discovered. */
public enum SourceKind {
    FEED,
    IMPORT
}
