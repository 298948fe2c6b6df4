package com.decisionengine.exception;

import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Raised by the tree builder when a variable is reached again from inside its own
 * expansion. The cycle lists the variables from the first occurrence back to the repeat.
 */
@Getter
public class CyclicRegistryException extends BaseException {

    private final List<String> cycle;

    public CyclicRegistryException(List<String> cycle) {
        super(
                ErrorCode.CYCLIC_REGISTRY,
                cycle.get(0),
                "Variable graph contains a cycle: " + String.join(" -> ", cycle),
                Map.of("cycle", List.copyOf(cycle)));
        this.cycle = List.copyOf(cycle);
    }
}
