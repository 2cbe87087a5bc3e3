package com.circuit.detector.flatten;

import java.util.List;
import java.util.Set;

import com.circuit.detector.model.Node;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Output of the {@link Flattener}: a hierarchy-free element list with canonical nodes.
 */
@Value
@Builder
public class FlattenedNetlist {
    @Singular
    List<Element> elements;
    /** Externally significant nodes; empty unless a definition was analyzed as the top scope. */
    @Singular
    Set<Node> topLevelPorts;
    /** Nodes named by a declaration (ports and bindings) that must exist even without elements. */
    @Singular
    Set<Node> declaredNodes;
    @Singular
    List<PortBinding> portBindings;
    int instanceCount;
    int definitionCount;

    public Node getGround() {
        return Node.GROUND;
    }

    public int elementCount() {
        return elements.size();
    }
}
