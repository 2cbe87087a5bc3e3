package com.circuit.detector.graph;

import java.util.Set;

import com.circuit.detector.model.EdgeKind;
import com.circuit.detector.model.Node;

import lombok.Value;

/**
 * One connected component under a given edge kind. Node order is discovery order.
 */
@Value
public class ConnectedComponent {
    int index;
    EdgeKind edgeKind;
    Set<Node> nodes;

    public boolean contains(Node node) {
        return nodes.contains(node);
    }

    public boolean containsGround() {
        return nodes.contains(Node.GROUND);
    }

    public int size() {
        return nodes.size();
    }
}
