package com.circuit.detector.flatten.exception;

/**
 * An element, or an instance, whose terminals do not fit its kind or definition.
 * The source line is 0 when the declaration did not come from netlist text.
 */
public class MalformedElementException extends NetlistStructureException {

    private static final long serialVersionUID = 1L;

    private final String elementName;
    private final String scopeName;
    private final int sourceLine;

    public MalformedElementException(String elementName, String scopeName, int sourceLine, String reason) {
        super("Malformed element '" + elementName + "' in " + scopeName
                + (sourceLine > 0 ? " (line " + sourceLine + ")" : "") + ": " + reason);
        this.elementName = elementName;
        this.scopeName = scopeName;
        this.sourceLine = sourceLine;
    }

    public String getElementName() {
        return elementName;
    }

    public String getScopeName() {
        return scopeName;
    }

    public int getSourceLine() {
        return sourceLine;
    }
}
