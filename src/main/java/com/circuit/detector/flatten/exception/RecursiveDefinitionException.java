package com.circuit.detector.flatten.exception;

import java.util.List;

/**
 * A definition instantiates itself, directly or through other definitions.
 */
public class RecursiveDefinitionException extends NetlistStructureException {

    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    public RecursiveDefinitionException(List<String> cycle) {
        super("Recursive subcircuit definition: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Definition names from the first repeated definition back to itself.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
