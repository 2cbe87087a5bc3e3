package com.circuit.detector.model;

/**
 * Edge sets of the connectivity graph.
 */
public enum EdgeKind {
    /**
     * DC-capable edges (resistors).
     */
    RESISTIVE,

    /**
     * AC-only edges (capacitors and coupling capacitors).
     */
    CAPACITIVE,

    /**
     * Union of both.
     */
    ANY;

    public boolean includes(EdgeKind edgeKind) {
        return this == ANY || this == edgeKind;
    }
}
