package com.studio.access.service;

/**
 * Result of resolving a secret against the record store. {@code match} is {@code null}
 * only for {@link Decision#NOT_FOUND}.
 */
public record VerificationOutcome(Decision decision, MatchedRecord match) {

    public enum Decision {
        ACCEPTED,
        REJECTED_EXPIRED,
        REJECTED_INACTIVE,
        NOT_FOUND
    }

    public static VerificationOutcome notFound() {
        return new VerificationOutcome(Decision.NOT_FOUND, null);
    }

    public static VerificationOutcome of(Decision decision, MatchedRecord match) {
        return new VerificationOutcome(decision, match);
    }
}
