package com.circuit.detector.analyzer.rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.circuit.detector.analyzer.DefectKind;
import com.circuit.detector.analyzer.Finding;
import com.circuit.detector.flatten.Element;
import com.circuit.detector.flatten.FlattenedNetlist;
import com.circuit.detector.graph.ConnectedComponent;
import com.circuit.detector.graph.ConnectivityGraph;
import com.circuit.detector.model.EdgeKind;
import com.circuit.detector.model.Node;

/**
 * Reports multi-node islands that reach neither ground nor a top-level port. One finding per
 * component, listing its nodes and the elements wired entirely inside it.
 */
public class IsolatedComponentRule implements DetectionRule {

    private static final int MAX_NODES_IN_DESCRIPTION = 10;

    @Override
    public DefectKind kind() {
        return DefectKind.ISOLATED_COMPONENT;
    }

    @Override
    public List<Finding> evaluate(ConnectivityGraph graph, FlattenedNetlist netlist) {
        Set<Node> externalNodes = netlist.getTopLevelPorts();
        List<Finding> findings = new ArrayList<>();

        for (ConnectedComponent component : graph.connectedComponents(EdgeKind.ANY)) {
            if (component.size() < 2 || component.containsGround()) {
                continue;
            }
            if (component.getNodes().stream().anyMatch(externalNodes::contains)) {
                continue;
            }

            List<String> nodeNames = component.getNodes().stream().map(Node::getName).toList();
            List<String> elementNames = graph.elementsWithin(component).stream()
                    .map(Element::getName)
                    .toList();

            findings.add(Finding.of(kind())
                    .subject(nodeNames.get(0))
                    .nodes(nodeNames)
                    .elements(elementNames)
                    .description(String.format(
                            "Isolated component of %d nodes (%s) and %d elements has no path to ground",
                            nodeNames.size(), summarize(nodeNames), elementNames.size()))
                    .build());
        }

        return findings;
    }

    private static String summarize(List<String> names) {
        if (names.size() <= MAX_NODES_IN_DESCRIPTION) {
            return String.join(", ", names);
        }
        return String.join(", ", names.subList(0, MAX_NODES_IN_DESCRIPTION))
                + ", ... " + (names.size() - MAX_NODES_IN_DESCRIPTION) + " more";
    }
}
