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
 * Reports connected nodes without a single resistive connection, whatever their other
 * connections reach. Works off the resistive degree only, so it stays valid for any
 * non-resistive element kind.
 */
public class DcFloatingNodeRule implements DetectionRule {

    @Override
    public DefectKind kind() {
        return DefectKind.DC_FLOATING_NODE;
    }

    @Override
    public List<Finding> evaluate(ConnectivityGraph graph, FlattenedNetlist netlist) {
        List<Finding> findings = new ArrayList<>();

        for (Node node : graph.nodes()) {
            if (node.isGround()) {
                continue;
            }
            if (graph.degree(node, EdgeKind.RESISTIVE) > 0 || graph.degree(node, EdgeKind.ANY) == 0) {
                continue;
            }

            int capacitive = graph.degree(node, EdgeKind.CAPACITIVE);
            List<String> elements = graph.incidentElements(node, EdgeKind.ANY).stream()
                    .map(Element::getName)
                    .toList();

            findings.add(Finding.of(kind())
                    .subject(node.getName())
                    .node(node.getName())
                    .elements(elements)
                    .description(String.format(
                            "Node %s is DC-floating: %d capacitive connections and no resistive connection "
                                    + "(r_degree=0)",
                            node, capacitive))
                    .build());
        }

        return findings;
    }
}
