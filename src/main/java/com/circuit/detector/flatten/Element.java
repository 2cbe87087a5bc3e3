package com.circuit.detector.flatten;

import java.util.List;

import com.circuit.detector.model.EdgeKind;
import com.circuit.detector.model.ElementKind;
import com.circuit.detector.model.Node;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A flattened element. Terminals are canonical nodes; the name carries the full instance path.
 */
@Value
@Builder
public class Element {
    @NonNull
    String name;
    @NonNull
    ElementKind kind;
    @Singular
    List<Node> terminals;
    Double value;
    /** Path of the instance that owns this element, empty at top level. */
    @NonNull
    String instancePath;

    public EdgeKind edgeKind() {
        return kind.edgeKind();
    }

    /**
     * True when this element was emitted while expanding the instance at {@code path}
     * or one of its descendants.
     */
    public boolean isInsideInstance(String path) {
        return instancePath.equals(path) || instancePath.startsWith(path + Flattener.PATH_SEPARATOR);
    }
}
