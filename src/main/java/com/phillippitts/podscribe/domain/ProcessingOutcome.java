package com.phillippitts.podscribe.domain;

import java.util.Objects;

/**
 * Result of running one candidate through the episode pipeline.
 *
 * @param status      SUCCESS, SKIPPED or FAILED
 * @param candidate   the processed candidate
 * @param detail      skip reason, failure message or output file name
 * @param failureKind set only when status is FAILED
 * @param error       underlying error when status is FAILED (may be null)
 */
public record ProcessingOutcome(
        Status status,
        EpisodeCandidate candidate,
        String detail,
        FailureKind failureKind,
        Throwable error
) {

    public enum Status { SUCCESS, SKIPPED, FAILED }

    public ProcessingOutcome {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(candidate, "candidate");
        if (status == Status.FAILED && failureKind == null) {
            throw new IllegalArgumentException("FAILED outcome requires a failure kind");
        }
    }

    public static ProcessingOutcome success(EpisodeCandidate candidate, String transcriptName) {
        return new ProcessingOutcome(Status.SUCCESS, candidate, transcriptName, null, null);
    }

    public static ProcessingOutcome skipped(EpisodeCandidate candidate, String reason) {
        return new ProcessingOutcome(Status.SKIPPED, candidate, reason, null, null);
    }

    public static ProcessingOutcome failed(EpisodeCandidate candidate, FailureKind kind, Throwable error) {
        String message = error == null ? kind.name() : String.valueOf(error.getMessage());
        return new ProcessingOutcome(Status.FAILED, candidate, message, kind, error);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isFailure() {
        return status == Status.FAILED;
    }
}
