package com.circuit.detector.analyzer.rule;

import java.util.ArrayList;
import java.util.List;

import com.circuit.detector.analyzer.DefectKind;
import com.circuit.detector.analyzer.Finding;
import com.circuit.detector.flatten.Element;
import com.circuit.detector.flatten.FlattenedNetlist;
import com.circuit.detector.flatten.PortBinding;
import com.circuit.detector.graph.ConnectivityGraph;
import com.circuit.detector.model.EdgeKind;
import com.circuit.detector.model.Node;

/**
 * Reports instance ports that were left unbound, or whose bound node is touched by nothing
 * outside the instance. Ports tied to ground or to a top-level port are connected by definition.
 *
 * When a single subcircuit is analyzed on its own, its declared ports are checked too: a port
 * that no element touches is reported.
 */
public class FloatingPortRule implements DetectionRule {

    @Override
    public DefectKind kind() {
        return DefectKind.FLOATING_PORT;
    }

    @Override
    public List<Finding> evaluate(ConnectivityGraph graph, FlattenedNetlist netlist) {
        List<Finding> findings = new ArrayList<>();

        for (Node port : netlist.getTopLevelPorts()) {
            if (!port.isGround() && graph.incidentElements(port, EdgeKind.ANY).isEmpty()) {
                findings.add(Finding.of(kind())
                        .subject(port.getName())
                        .node(port.getName())
                        .description("Port " + port + " is declared but no element inside the subcircuit connects to it")
                        .build());
            }
        }

        for (PortBinding binding : netlist.getPortBindings()) {
            Node node = binding.getNode();
            if (node.isGround() || netlist.getTopLevelPorts().contains(node)) {
                continue;
            }

            List<String> inside = graph.incidentElements(node, EdgeKind.ANY).stream()
                    .filter(e -> e.isInsideInstance(binding.getInstancePath()))
                    .map(Element::getName)
                    .toList();

            if (!binding.isBound()) {
                findings.add(finding(binding, inside, String.format(
                        "Port %s (#%d) of instance %s (%s) is not connected",
                        binding.getPortName(), binding.getPortIndex() + 1,
                        binding.getInstancePath(), binding.getDefinitionName())));
                continue;
            }

            long outside = graph.incidentElements(node, EdgeKind.ANY).stream()
                    .filter(e -> !e.isInsideInstance(binding.getInstancePath()))
                    .count();
            if (outside == 0) {
                findings.add(finding(binding, inside, String.format(
                        "Port %s of instance %s (%s) is bound to node %s which has no connections outside the instance",
                        binding.getPortName(), binding.getInstancePath(), binding.getDefinitionName(), node)));
            }
        }

        return findings;
    }

    private Finding finding(PortBinding binding, List<String> elements, String description) {
        return Finding.of(kind())
                .subject(binding.getInstancePath() + ":" + binding.getPortName())
                .node(binding.getNode().getName())
                .elements(elements)
                .description(description)
                .build();
    }
}
