package com.example.abac.model;

import org.springframework.lang.Nullable;

/**
 * Outcome of matching one policy. A failed match counts as no match.
 */
public record MatchResult(Status status, @Nullable MatchError error) {

    public enum Status {
        MATCHED, NOT_MATCHED, FAILED
    }

    private static final MatchResult MATCHED = new MatchResult(Status.MATCHED, null);
    private static final MatchResult NOT_MATCHED = new MatchResult(Status.NOT_MATCHED, null);

    public static MatchResult matched() {
        return MATCHED;
    }

    public static MatchResult noMatch() {
        return NOT_MATCHED;
    }

    public static MatchResult failed(MatchError error) {
        return new MatchResult(Status.FAILED, error);
    }

    public static MatchResult of(boolean matched) {
        return matched ? MATCHED : NOT_MATCHED;
    }

    public boolean isMatched() {
        return status == Status.MATCHED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
