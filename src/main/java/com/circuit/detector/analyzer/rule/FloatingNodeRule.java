package com.circuit.detector.analyzer.rule;

import java.util.ArrayList;
import java.util.List;

import com.circuit.detector.analyzer.DefectKind;
import com.circuit.detector.analyzer.Finding;
import com.circuit.detector.flatten.Element;
import com.circuit.detector.flatten.FlattenedNetlist;
import com.circuit.detector.graph.ConnectivityGraph;
import com.circuit.detector.model.EdgeKind;
import com.circuit.detector.model.Node;

/**
 * Reports nodes that touch nothing, nodes alone in their component, and nodes whose only
 * element touches no other element. A node with two or more distinct elements is never
 * floating, and neither is ground. Top-level ports are left to {@link FloatingPortRule}.
 */
public class FloatingNodeRule implements DetectionRule {

    @Override
    public DefectKind kind() {
        return DefectKind.FLOATING_NODE;
    }

    @Override
    public List<Finding> evaluate(ConnectivityGraph graph, FlattenedNetlist netlist) {
        List<Finding> findings = new ArrayList<>();

        for (Node node : graph.nodes()) {
            if (node.isGround() || netlist.getTopLevelPorts().contains(node)) {
                continue;
            }

            List<Element> incident = graph.incidentElements(node, EdgeKind.ANY);
            if (incident.isEmpty()) {
                findings.add(Finding.of(kind())
                        .subject(node.getName())
                        .node(node.getName())
                        .description("Node " + node + " has no connections (degree=0)")
                        .build());
                continue;
            }

            if (incident.size() != 1) {
                continue;
            }
            Element element = incident.get(0);
            boolean alone = graph.componentOf(node, EdgeKind.ANY)
                    .map(c -> c.size() == 1)
                    .orElse(true);
            if (alone) {
                findings.add(finding(node, element, "Node " + node + " is only connected to itself through "
                        + element.getName()));
            } else if (isLoneElement(graph, element)) {
                findings.add(finding(node, element, "Node " + node + " is only connected to "
                        + element.getName() + ", which connects to no other element"));
            }
        }

        return findings;
    }

    private Finding finding(Node node, Element element, String description) {
        return Finding.of(kind())
                .subject(node.getName())
                .node(node.getName())
                .element(element.getName())
                .description(description)
                .build();
    }

    /**
     * True when no terminal of {@code element} is shared with another element.
     */
    private static boolean isLoneElement(ConnectivityGraph graph, Element element) {
        return element.getTerminals().stream()
                .allMatch(t -> graph.incidentElements(t, EdgeKind.ANY).size() == 1);
    }
}
