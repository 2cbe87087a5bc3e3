package com.circuit.detector.parser;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One logical netlist line (continuations already joined), split into whitespace tokens.
 */
@Data
@AllArgsConstructor
public class SpiceLine {
    private LineType type;
    private List<String> tokens;
    private int lineNumber;

    public enum LineType {
        SUBCKT_START,
        SUBCKT_END,
        RESISTOR,
        CAPACITOR,
        COUPLING_CAPACITOR,
        INSTANCE,
        DIRECTIVE,
        UNKNOWN
    }

    public String first() {
        return tokens.get(0);
    }

    public String text() {
        return String.join(" ", tokens);
    }
}
