package com.circuit.detector.analyzer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.circuit.detector.analyzer.rule.CapacitorOnlyRule;
import com.circuit.detector.analyzer.rule.DcFloatingNodeRule;
import com.circuit.detector.analyzer.rule.DetectionRule;
import com.circuit.detector.analyzer.rule.FloatingNodeRule;
import com.circuit.detector.analyzer.rule.FloatingPortRule;
import com.circuit.detector.analyzer.rule.IsolatedComponentRule;
import com.circuit.detector.analyzer.rule.UnusedPortRule;
import com.circuit.detector.flatten.FlattenedNetlist;
import com.circuit.detector.graph.ConnectivityGraph;

/**
 * Runs a registry of {@link DetectionRule}s against one graph and returns the union of their
 * findings. No deduplication across rules: one node can appear under several defect kinds.
 *
 * Output order is registry order, then each rule's own order, also when rules run in parallel.
 */
public class OpenCircuitAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(OpenCircuitAnalyzer.class);

    private final List<DetectionRule> rules;
    private final boolean parallel;

    public OpenCircuitAnalyzer(List<DetectionRule> rules, boolean parallel) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.parallel = parallel;
    }

    public OpenCircuitAnalyzer(List<DetectionRule> rules) {
        this(rules, false);
    }

    public static List<DetectionRule> defaultRules() {
        return List.of(
                new FloatingNodeRule(),
                new IsolatedComponentRule(),
                new FloatingPortRule(),
                new CapacitorOnlyRule(),
                new DcFloatingNodeRule(),
                new UnusedPortRule()
        );
    }

    public static OpenCircuitAnalyzer withDefaultRules() {
        return new OpenCircuitAnalyzer(defaultRules());
    }

    /**
     * The default rules minus the given kinds.
     */
    public static OpenCircuitAnalyzer withDefaultRulesExcept(Collection<DefectKind> disabled, boolean parallel) {
        Set<DefectKind> skip = disabled == null ? Set.of() : Set.copyOf(disabled);
        List<DetectionRule> enabled = new ArrayList<>();
        for (DetectionRule rule : defaultRules()) {
            if (skip.contains(rule.kind())) {
                log.info("Rule disabled: {}", rule.kind());
            } else {
                enabled.add(rule);
            }
        }
        return new OpenCircuitAnalyzer(enabled, parallel);
    }

    public List<DetectionRule> getRules() {
        return rules;
    }

    public List<Finding> analyze(ConnectivityGraph graph, FlattenedNetlist netlist) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(netlist, "netlist");

        Stream<DetectionRule> stream = parallel ? rules.parallelStream() : rules.stream();
        List<Finding> findings = stream
                .flatMap(rule -> evaluate(rule, graph, netlist).stream())
                .toList();

        log.info("Analysis complete: {} findings from {} rules", findings.size(), rules.size());
        return findings;
    }

    private List<Finding> evaluate(DetectionRule rule, ConnectivityGraph graph, FlattenedNetlist netlist) {
        List<Finding> found = rule.evaluate(graph, netlist);
        log.debug("Rule {} reported {} findings", rule.kind(), found.size());
        return found;
    }
}
