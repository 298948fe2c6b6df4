package com.decisionengine.domain.enums;

/**
 * Kind of a declared variable, copied onto every tree node unfolded from it.
 */
public enum VariableKind {
    DECISION,
    CHANCE,
    TERMINAL;

    public boolean hasBranches() {
        return this != TERMINAL;
    }
}
