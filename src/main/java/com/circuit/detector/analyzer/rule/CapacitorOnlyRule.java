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
 * Reports nodes that have capacitive connections but no resistive path to ground. Such a node
 * is connected for AC but has no DC return path. Top-level ports may be AC-coupled on purpose
 * and are skipped.
 */
public class CapacitorOnlyRule implements DetectionRule {

    @Override
    public DefectKind kind() {
        return DefectKind.CAPACITOR_ONLY;
    }

    @Override
    public List<Finding> evaluate(ConnectivityGraph graph, FlattenedNetlist netlist) {
        List<Finding> findings = new ArrayList<>();

        for (Node node : graph.nodes()) {
            if (netlist.getTopLevelPorts().contains(node)) {
                continue;
            }
            int capacitive = graph.degree(node, EdgeKind.CAPACITIVE);
            if (capacitive == 0 || graph.hasGroundPath(node, EdgeKind.RESISTIVE)) {
                continue;
            }

            int resistive = graph.degree(node, EdgeKind.RESISTIVE);
            List<String> capacitors = graph.incidentElements(node, EdgeKind.CAPACITIVE).stream()
                    .map(Element::getName)
                    .toList();

            findings.add(Finding.of(kind())
                    .subject(node.getName())
                    .node(node.getName())
                    .elements(capacitors)
                    .description(String.format(
                            "Node %s is reachable only through capacitors and has no resistive path to ground "
                                    + "(c_degree=%d, r_degree=%d)",
                            node, capacitive, resistive))
                    .build());
        }

        return findings;
    }
}
