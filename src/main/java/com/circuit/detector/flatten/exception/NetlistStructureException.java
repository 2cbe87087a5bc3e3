package com.circuit.detector.flatten.exception;

/**
 * Structural defect that prevents a netlist from being flattened. Fatal to the whole run.
 */
public abstract class NetlistStructureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected NetlistStructureException(String message) {
        super(message);
    }
}
