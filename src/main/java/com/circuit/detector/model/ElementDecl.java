package com.circuit.detector.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * An element as declared inside a definition, with terminals still in local (raw) names.
 */
@Value
@Builder
public class ElementDecl {
    @NonNull
    String name;
    @NonNull
    ElementKind kind;
    @Singular
    List<String> terminals;
    /** Declared value in base units, or null when the line carried none. */
    Double value;
    int sourceLine;

    public static ElementDecl of(String name, ElementKind kind, String node1, String node2, Double value) {
        return ElementDecl.builder()
                .name(name)
                .kind(kind)
                .terminal(node1)
                .terminal(node2)
                .value(value)
                .build();
    }

    public static ElementDecl resistor(String name, String node1, String node2) {
        return of(name, ElementKind.RESISTOR, node1, node2, null);
    }

    public static ElementDecl capacitor(String name, String node1, String node2) {
        return of(name, ElementKind.CAPACITOR, node1, node2, null);
    }

    public static ElementDecl couplingCapacitor(String name, String node1, String node2) {
        return of(name, ElementKind.COUPLING_CAPACITOR, node1, node2, null);
    }
}
