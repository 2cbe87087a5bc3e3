package com.circuit.detector.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class NodeTest {

    @ParameterizedTest
    @ValueSource(strings = { "0", "gnd", "GND", "vss", "VSS", "Ground", " gnd " })
    void testGroundAliasesCollapseToGround(String alias) {
        Node node = Node.of(alias);

        assertThat(node).isSameAs(Node.GROUND);
        assertThat(node.isGround()).isTrue();
        assertThat(node.getName()).isEqualTo("0");
    }

    @Test
    void testCanonicalizationIsIdempotent() {
        Node node = Node.of("X1/N_Out");

        assertThat(node.getName()).isEqualTo("x1/n_out");
        assertThat(Node.of(node.getName())).isEqualTo(node);
        assertThat(Node.of(Node.GROUND.getName())).isSameAs(Node.GROUND);
    }

    @Test
    void testNamesCompareIgnoringCase() {
        assertThat(Node.of("VDD")).isEqualTo(Node.of("vdd"));
        assertThat(Node.of("a")).isNotEqualTo(Node.of("b"));
        assertThat(Node.of("a").isGround()).isFalse();
    }

    @Test
    void testBlankNameIsRejected() {
        assertThatThrownBy(() -> Node.of("  "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testIsGroundAlias() {
        assertThat(Node.isGroundAlias("VSS")).isTrue();
        assertThat(Node.isGroundAlias("vdd")).isFalse();
        assertThat(Node.isGroundAlias(null)).isFalse();
    }
}
