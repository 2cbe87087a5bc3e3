package com.circuit.detector.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Circuit primitives understood by the detector.
 */
public enum ElementKind {
    RESISTOR,
    CAPACITOR,
    COUPLING_CAPACITOR;

    /**
     * Number of terminals a well-formed element of this kind declares.
     */
    public int terminalCount() {
        return switch (this) {
            case RESISTOR, CAPACITOR, COUPLING_CAPACITOR -> 2;
        };
    }

    /**
     * The edge set this kind contributes to.
     */
    public EdgeKind edgeKind() {
        return switch (this) {
            case RESISTOR -> EdgeKind.RESISTIVE;
            case CAPACITOR, COUPLING_CAPACITOR -> EdgeKind.CAPACITIVE;
        };
    }

    /**
     * Classify an element by its SPICE name. Coupling capacitors ({@code cc*}) are checked
     * before plain capacitors ({@code c*}).
     */
    public static Optional<ElementKind> fromElementName(String elementName) {
        if (elementName == null || elementName.isBlank()) {
            return Optional.empty();
        }
        String normalized = elementName.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("cc")) {
            return Optional.of(COUPLING_CAPACITOR);
        }
        if (normalized.startsWith("c")) {
            return Optional.of(CAPACITOR);
        }
        if (normalized.startsWith("r")) {
            return Optional.of(RESISTOR);
        }
        return Optional.empty();
    }
}
