package com.forgeloop.core.model;

import java.util.Optional;

/**
 * Result of voting over speculative candidates.
 */
public record VoteOutcome(Proof proof, VoteTier tier) {

    public static VoteOutcome none() {
        return new VoteOutcome(null, VoteTier.NONE);
    }

    public Optional<Proof> winner() {
        return Optional.ofNullable(proof);
    }

    public boolean isVerified() {
        return tier == VoteTier.VERIFIED;
    }
}
