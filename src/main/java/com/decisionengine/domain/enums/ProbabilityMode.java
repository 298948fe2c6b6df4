package com.decisionengine.domain.enums;

/**
 * How chance-branch probabilities that do not sum to one are handled at registration.
 */
public enum ProbabilityMode {
    /** Reject the declaration. */
    STRICT,
    /** Rescale the probabilities so they sum to one. */
    NORMALIZE
}
