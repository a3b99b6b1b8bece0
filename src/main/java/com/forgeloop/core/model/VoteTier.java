package com.forgeloop.core.model;

/**
 * How a speculative winner was chosen. Only {@link #VERIFIED} may be committed.
 */
public enum VoteTier {
    /** Every declared gate is present and passed. */
    VERIFIED,
    /** The toolchain claims all gates passed but declared gates are missing or failing. */
    ALL_PASSED,
    /** Successful dispatch with no gate evidence. */
    UNVERIFIED,
    NONE
}
