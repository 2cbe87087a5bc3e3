package com.circuit.detector.flatten;

import com.circuit.detector.model.Node;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * How one port of one instantiation was connected during flattening.
 */
@Value
@Builder
public class PortBinding {
    @NonNull
    String instancePath;
    @NonNull
    String definitionName;
    @NonNull
    String portName;
    int portIndex;
    /** The enclosing-scope node, or a fresh node under the instance path when unbound. */
    @NonNull
    Node node;
    boolean bound;
}
