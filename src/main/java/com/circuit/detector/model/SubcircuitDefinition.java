package com.circuit.detector.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A reusable template: ordered ports, internal elements and nested instances, all in local names.
 */
@Value
@Builder
public class SubcircuitDefinition {
    @NonNull
    String name;
    @Singular
    List<String> ports;
    @Singular
    List<ElementDecl> elements;
    @Singular
    List<Instance> instances;
}
