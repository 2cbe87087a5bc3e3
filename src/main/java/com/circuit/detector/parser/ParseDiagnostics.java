package com.circuit.detector.parser;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Non-fatal findings collected while reading a netlist.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ParseDiagnostics {
    private final List<String> warnings = new ArrayList<>();

    public void warn(String fileName, int lineNumber, String message) {
        warnings.add(fileName + " line " + lineNumber + ": " + message);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
