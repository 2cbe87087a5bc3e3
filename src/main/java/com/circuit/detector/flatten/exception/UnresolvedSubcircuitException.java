package com.circuit.detector.flatten.exception;

/**
 * An instance references a definition that is not in the netlist.
 */
public class UnresolvedSubcircuitException extends NetlistStructureException {

    private static final long serialVersionUID = 1L;

    private final String definitionName;
    private final String instancePath;

    public UnresolvedSubcircuitException(String definitionName, String instancePath) {
        super("Unresolved subcircuit '" + definitionName + "' referenced by instance " + instancePath);
        this.definitionName = definitionName;
        this.instancePath = instancePath;
    }

    public String getDefinitionName() {
        return definitionName;
    }

    public String getInstancePath() {
        return instancePath;
    }
}
