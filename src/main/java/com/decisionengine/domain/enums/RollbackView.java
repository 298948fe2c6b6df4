package com.decisionengine.domain.enums;

/**
 * Which root quantity a rollback returns: expected value, expected utility or certainty equivalent.
 */
public enum RollbackView {
    EV,
    EU,
    CE
}
