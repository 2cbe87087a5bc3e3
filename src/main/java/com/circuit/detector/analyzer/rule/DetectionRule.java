package com.circuit.detector.analyzer.rule;

import java.util.List;

import com.circuit.detector.analyzer.DefectKind;
import com.circuit.detector.analyzer.Finding;
import com.circuit.detector.flatten.FlattenedNetlist;
import com.circuit.detector.graph.ConnectivityGraph;

/**
 * A single, independent defect check.
 *
 * Implementations must only read their inputs and keep no state between calls, so rules can run
 * in any order or concurrently against the same graph.
 */
public interface DetectionRule {

    /**
     * The defect kind this rule reports.
     */
    DefectKind kind();

    /**
     * Evaluate the rule. Findings are returned in a deterministic order.
     */
    List<Finding> evaluate(ConnectivityGraph graph, FlattenedNetlist netlist);
}
