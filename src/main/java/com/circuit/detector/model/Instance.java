package com.circuit.detector.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One use of a subcircuit definition. Connections bind the definition's ports, by position,
 * to nodes of the enclosing scope.
 */
@Value
@Builder
public class Instance {
    @NonNull
    String name;
    @NonNull
    String definitionName;
    @Singular
    List<String> connections;
    int sourceLine;

    public static Instance of(String name, String definitionName, String... connections) {
        return Instance.builder()
                .name(name)
                .definitionName(definitionName)
                .connections(List.of(connections))
                .build();
    }
}
