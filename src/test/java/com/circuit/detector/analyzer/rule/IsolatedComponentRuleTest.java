package com.circuit.detector.analyzer.rule;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.circuit.detector.NetlistFixtures;
import com.circuit.detector.NetlistFixtures.Analyzed;
import com.circuit.detector.analyzer.DefectKind;
import com.circuit.detector.analyzer.Finding;

import static org.assertj.core.api.Assertions.*;

class IsolatedComponentRuleTest {

    private final IsolatedComponentRule rule = new IsolatedComponentRule();

    @Test
    void testIslandWithoutGroundIsReported() {
        Analyzed analyzed = NetlistFixtures.analyze("""
            r1 in 0 1k
            c1 in 0 1f
            r2 p q 1k
            r3 q r 1k
            """);

        List<Finding> findings = rule.evaluate(analyzed.graph, analyzed.netlist);

        assertThat(findings).singleElement().satisfies(f -> {
            assertThat(f.getKind()).isEqualTo(DefectKind.ISOLATED_COMPONENT);
            assertThat(f.getNodes()).containsExactlyInAnyOrder("p", "q", "r");
            assertThat(f.getElements()).containsExactly("r2", "r3");
            assertThat(f.getDescription()).contains("3 nodes").contains("2 elements");
        });
    }

    @Test
    void testIslandInsideInstanceIsReported() {
        Analyzed analyzed = NetlistFixtures.analyze("""
            .subckt blk a
            r1 a 0 1k
            r2 u v 1k
            .ends
            x1 n blk
            """);

        List<Finding> findings = rule.evaluate(analyzed.graph, analyzed.netlist);

        assertThat(findings).singleElement()
                .satisfies(f -> assertThat(f.getNodes()).containsExactly("x1/u", "x1/v"));
    }

    @Test
    void testComponentWithTopLevelPortIsNotIsolated() {
        Analyzed analyzed = NetlistFixtures.analyzeDefinition("""
            .subckt blk p
            r1 p q 1k
            r2 q r 1k
            .ends
            """, "blk");

        assertThat(rule.evaluate(analyzed.graph, analyzed.netlist)).isEmpty();
    }

    @Test
    void testSingleNodesAreLeftToTheFloatingNodeRule() {
        Analyzed analyzed = NetlistFixtures.analyze("""
            r1 a a 1k
            r2 b 0 1k
            """);

        assertThat(rule.evaluate(analyzed.graph, analyzed.netlist)).isEmpty();
    }
}
