package com.decisionengine.domain.enums;

/**
 * Direction in which a decision node selects its preferred branch.
 */
public enum OptimizationSense {
    MAXIMIZE,
    MINIMIZE;

    /**
     * Returns true when {@code candidate} is strictly better than {@code incumbent}.
     * Equal values never win, so ties keep the earlier branch.
     */
    public boolean isBetter(double candidate, double incumbent) {
        return this == MAXIMIZE ? candidate > incumbent : candidate < incumbent;
    }
}
