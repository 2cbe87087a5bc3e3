package com.circuit.detector.report;

import com.circuit.detector.flatten.FlattenedNetlist;
import com.circuit.detector.graph.ConnectivityGraph;
import com.circuit.detector.model.EdgeKind;

import lombok.Builder;
import lombok.Value;

/**
 * Size statistics of the analyzed netlist.
 */
@Value
@Builder
public class NetlistSummary {
    int elements;
    int nodes;
    int components;
    int resistiveComponents;
    int definitions;
    int instances;

    public static NetlistSummary of(ConnectivityGraph graph, FlattenedNetlist netlist) {
        return NetlistSummary.builder()
                .elements(netlist.elementCount())
                .nodes(graph.nodes().size())
                .components(graph.connectedComponents(EdgeKind.ANY).size())
                .resistiveComponents(graph.connectedComponents(EdgeKind.RESISTIVE).size())
                .definitions(netlist.getDefinitionCount())
                .instances(netlist.getInstanceCount())
                .build();
    }
}
