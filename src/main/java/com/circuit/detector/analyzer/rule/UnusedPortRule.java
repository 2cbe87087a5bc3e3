package com.circuit.detector.analyzer.rule;

import java.util.ArrayList;
import java.util.List;

import com.circuit.detector.analyzer.DefectKind;
import com.circuit.detector.analyzer.Finding;
import com.circuit.detector.flatten.FlattenedNetlist;
import com.circuit.detector.flatten.PortBinding;
import com.circuit.detector.graph.ConnectivityGraph;
import com.circuit.detector.model.EdgeKind;

/**
 * Reports ports declared by a subcircuit that no element inside the instance touches.
 */
public class UnusedPortRule implements DetectionRule {

    @Override
    public DefectKind kind() {
        return DefectKind.UNUSED_PORT;
    }

    @Override
    public List<Finding> evaluate(ConnectivityGraph graph, FlattenedNetlist netlist) {
        List<Finding> findings = new ArrayList<>();

        for (PortBinding binding : netlist.getPortBindings()) {
            if (binding.getNode().isGround()) {
                continue;
            }
            boolean used = graph.incidentElements(binding.getNode(), EdgeKind.ANY).stream()
                    .anyMatch(e -> e.isInsideInstance(binding.getInstancePath()));
            if (!used) {
                findings.add(Finding.of(kind())
                        .subject(binding.getInstancePath() + ":" + binding.getPortName())
                        .node(binding.getNode().getName())
                        .description(String.format(
                                "Port %s of subcircuit %s is not used by any element inside instance %s",
                                binding.getPortName(), binding.getDefinitionName(), binding.getInstancePath()))
                        .build());
            }
        }

        return findings;
    }
}
