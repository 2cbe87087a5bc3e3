package com.circuit.detector.parser;

/**
 * Netlist text that cannot be turned into a netlist model.
 */
public class SpiceParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String fileName;
    private final int lineNumber;

    public SpiceParseException(String fileName, int lineNumber, String message) {
        super(fileName + " line " + lineNumber + ": " + message);
        this.fileName = fileName;
        this.lineNumber = lineNumber;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
