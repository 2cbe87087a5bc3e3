package com.circuit.detector.flatten;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.circuit.detector.NetlistFixtures;
import com.circuit.detector.flatten.exception.MalformedElementException;
import com.circuit.detector.flatten.exception.NetlistStructureException;
import com.circuit.detector.flatten.exception.RecursiveDefinitionException;
import com.circuit.detector.flatten.exception.UnresolvedSubcircuitException;
import com.circuit.detector.model.ElementDecl;
import com.circuit.detector.model.ElementKind;
import com.circuit.detector.model.Instance;
import com.circuit.detector.model.NetlistModel;
import com.circuit.detector.model.Node;
import com.circuit.detector.model.SubcircuitDefinition;

import static org.assertj.core.api.Assertions.*;

class FlattenerTest {

    private static SubcircuitDefinition divider() {
        return SubcircuitDefinition.builder()
                .name("divider")
                .port("p")
                .port("q")
                .element(ElementDecl.resistor("r1", "p", "mid"))
                .element(ElementDecl.capacitor("c1", "mid", "q"))
                .build();
    }

    @Test
    void testInternalNodesArePathPrefixed() {
        NetlistModel model = NetlistModel.of(
                List.of(ElementDecl.resistor("r1", "in", "a")),
                List.of(Instance.of("X1", "DIVIDER", "a", "gnd")),
                List.of(divider()));

        FlattenedNetlist flat = new Flattener(model).flatten();

        assertThat(flat.getElements()).extracting(Element::getName)
                .containsExactly("r1", "x1/r1", "x1/c1");

        Element inner = flat.getElements().get(1);
        assertThat(inner.getTerminals()).containsExactly(Node.of("a"), Node.of("x1/mid"));
        assertThat(inner.getInstancePath()).isEqualTo("x1");
        assertThat(flat.getElements().get(2).getTerminals()).containsExactly(Node.of("x1/mid"), Node.GROUND);
        assertThat(flat.getInstanceCount()).isEqualTo(1);
        assertThat(flat.getDefinitionCount()).isEqualTo(1);
    }

    @Test
    void testFlatteningIsDeterministic() {
        NetlistModel model = NetlistModel.of(
                List.of(ElementDecl.resistor("r0", "a", "0")),
                List.of(Instance.of("x1", "divider", "a", "b"), Instance.of("x2", "divider", "b", "0")),
                List.of(divider()));

        FlattenedNetlist first = new Flattener(model).flatten();
        FlattenedNetlist second = new Flattener(model).flatten();

        assertThat(first.getElements()).isEqualTo(second.getElements());
        assertThat(first.getPortBindings()).isEqualTo(second.getPortBindings());
        assertThat(first.getDeclaredNodes()).containsExactlyElementsOf(second.getDeclaredNodes());
    }

    @Test
    void testNoElementLossAcrossNestedInstances() {
        SubcircuitDefinition leaf = SubcircuitDefinition.builder()
                .name("leaf")
                .port("p")
                .element(ElementDecl.resistor("r1", "p", "0"))
                .build();
        SubcircuitDefinition pair = SubcircuitDefinition.builder()
                .name("pair")
                .port("a")
                .element(ElementDecl.resistor("r9", "a", "0"))
                .instance(Instance.of("x1", "leaf", "a"))
                .instance(Instance.of("x2", "leaf", "a"))
                .build();
        NetlistModel model = NetlistModel.of(
                List.of(),
                List.of(Instance.of("x1", "pair", "n"), Instance.of("x2", "pair", "n")),
                List.of(leaf, pair));

        FlattenedNetlist flat = new Flattener(model).flatten();

        assertThat(flat.elementCount()).isEqualTo(6);
        assertThat(flat.getElements()).extracting(Element::getName).containsExactly(
                "x1/r9", "x1/x1/r1", "x1/x2/r1",
                "x2/r9", "x2/x1/r1", "x2/x2/r1");
        assertThat(flat.getInstanceCount()).isEqualTo(6);
        assertThat(flat.getElements().get(1).getTerminals()).containsExactly(Node.of("n"), Node.GROUND);
    }

    @Test
    void testGroundAliasInsideSubcircuitIsGlobal() {
        SubcircuitDefinition tie = SubcircuitDefinition.builder()
                .name("tie")
                .port("a")
                .element(ElementDecl.resistor("r1", "a", "VSS"))
                .build();
        NetlistModel model = NetlistModel.of(List.of(), List.of(Instance.of("x1", "tie", "n")), List.of(tie));

        Element r1 = new Flattener(model).flatten().getElements().get(0);

        assertThat(r1.getTerminals()).containsExactly(Node.of("n"), Node.GROUND);
    }

    @Test
    void testUnresolvedSubcircuit() {
        NetlistModel model = NetlistModel.of(List.of(), List.of(Instance.of("x1", "missing", "a")), List.of());

        assertThatThrownBy(() -> new Flattener(model).flatten())
                .isInstanceOfSatisfying(UnresolvedSubcircuitException.class, e -> {
                    assertThat(e.getDefinitionName()).isEqualTo("missing");
                    assertThat(e.getInstancePath()).isEqualTo("x1");
                });
    }

    @Test
    void testDirectRecursionIsDetected() {
        SubcircuitDefinition self = SubcircuitDefinition.builder()
                .name("a")
                .port("n")
                .instance(Instance.of("x1", "a", "n"))
                .build();
        NetlistModel model = NetlistModel.of(List.of(), List.of(Instance.of("x1", "a", "top")), List.of(self));

        assertThatThrownBy(() -> new Flattener(model).flatten())
                .isInstanceOfSatisfying(RecursiveDefinitionException.class,
                        e -> assertThat(e.getCycle()).containsExactly("a", "a"));
    }

    @Test
    void testTransitiveRecursionIsDetected() {
        SubcircuitDefinition a = SubcircuitDefinition.builder()
                .name("a")
                .port("n")
                .element(ElementDecl.resistor("r1", "n", "0"))
                .instance(Instance.of("xb", "b", "n"))
                .build();
        SubcircuitDefinition b = SubcircuitDefinition.builder()
                .name("b")
                .port("n")
                .instance(Instance.of("xa", "A", "n"))
                .build();
        NetlistModel model = NetlistModel.of(List.of(), List.of(Instance.of("x1", "a", "top")), List.of(a, b));

        assertThatThrownBy(() -> new Flattener(model).flatten())
                .isInstanceOf(NetlistStructureException.class)
                .isInstanceOfSatisfying(RecursiveDefinitionException.class,
                        e -> assertThat(e.getCycle()).containsExactly("a", "b", "a"))
                .hasMessageContaining("a -> b -> a");
    }

    @Test
    void testMalformedElement() {
        ElementDecl oneLegged = ElementDecl.builder()
                .name("r1")
                .kind(ElementKind.RESISTOR)
                .terminal("a")
                .build();
        NetlistModel model = NetlistModel.of(List.of(oneLegged), List.of(), List.of());

        assertThatThrownBy(() -> new Flattener(model).flatten())
                .isInstanceOfSatisfying(MalformedElementException.class,
                        e -> assertThat(e.getElementName()).isEqualTo("r1"))
                .hasMessageContaining("expects 2 terminals but declares 1");
    }

    @Test
    void testTooManyConnectionsIsMalformed() {
        NetlistModel model = NetlistModel.of(
                List.of(), List.of(Instance.of("x1", "divider", "a", "b", "c")), List.of(divider()));

        assertThatThrownBy(() -> new Flattener(model).flatten())
                .isInstanceOfSatisfying(MalformedElementException.class,
                        e -> assertThat(e.getElementName()).isEqualTo("x1"));
    }

    @Test
    void testGroundNamedPortFollowsItsBinding() {
        NetlistModel model = NetlistFixtures.model("""
            .subckt cell in vss
            r1 in vss 1k
            .ends
            x1 a b cell
            x2 a cell
            """);

        FlattenedNetlist flat = new Flattener(model).flatten();

        assertThat(flat.getElements().get(0).getTerminals()).containsExactly(Node.of("a"), Node.of("b"));
        assertThat(flat.getPortBindings().get(1).getNode()).isEqualTo(Node.of("b"));
        assertThat(flat.getElements().get(1).getTerminals()).containsExactly(Node.of("a"), Node.GROUND);
    }

    @Test
    void testHierarchySeparatorInRawNameIsMalformed() {
        NetlistModel model = NetlistFixtures.model("""
            .subckt cell p
            r1 p mid 1k
            .ends
            x1 a cell
            r9 x1/mid q 1k
            """);

        assertThatThrownBy(() -> new Flattener(model).flatten())
                .isInstanceOfSatisfying(MalformedElementException.class, e -> {
                    assertThat(e.getElementName()).isEqualTo("r9");
                    assertThat(e.getSourceLine()).isEqualTo(5);
                })
                .hasMessageContaining("(line 5)")
                .hasMessageContaining("hierarchy separator");
    }

    @Test
    void testMalformedInstanceCarriesItsLine() {
        NetlistModel model = NetlistFixtures.model("""
            r0 a 0 1k
            .subckt one p
            r1 p 0 1k
            .ends
            x1 a b one
            """);

        assertThatThrownBy(() -> new Flattener(model).flatten())
                .isInstanceOfSatisfying(MalformedElementException.class,
                        e -> assertThat(e.getSourceLine()).isEqualTo(5))
                .hasMessageContaining("'x1'")
                .hasMessageContaining("(line 5)");
    }

    @Test
    void testUnboundPortBecomesInternalNode() {
        NetlistModel model = NetlistModel.of(List.of(), List.of(Instance.of("x1", "divider", "a")), List.of(divider()));

        FlattenedNetlist flat = new Flattener(model).flatten();

        assertThat(flat.getPortBindings()).hasSize(2);
        PortBinding p = flat.getPortBindings().get(0);
        PortBinding q = flat.getPortBindings().get(1);
        assertThat(p.isBound()).isTrue();
        assertThat(p.getNode()).isEqualTo(Node.of("a"));
        assertThat(q.isBound()).isFalse();
        assertThat(q.getPortIndex()).isEqualTo(1);
        assertThat(q.getNode()).isEqualTo(Node.of("x1/q"));
        assertThat(flat.getDeclaredNodes()).contains(Node.of("a"), Node.of("x1/q"));
        assertThat(flat.getElements().get(1).getTerminals()).containsExactly(Node.of("x1/mid"), Node.of("x1/q"));
    }

    @Test
    void testFlattenDefinitionAsTopScope() {
        NetlistModel model = NetlistModel.of(List.of(), List.of(), List.of(divider()));

        FlattenedNetlist flat = new Flattener(model).flattenDefinition("Divider");

        assertThat(flat.getTopLevelPorts()).containsExactly(Node.of("p"), Node.of("q"));
        assertThat(flat.getDeclaredNodes()).contains(Node.of("p"), Node.of("q"));
        assertThat(flat.getElements()).extracting(Element::getName).containsExactly("r1", "c1");
        assertThat(flat.getElements().get(0).getInstancePath()).isEmpty();
    }

    @Test
    void testFlattenUnknownDefinition() {
        NetlistModel model = NetlistModel.of(List.of(), List.of(), List.of(divider()));

        assertThatThrownBy(() -> new Flattener(model).flattenDefinition("nope"))
                .isInstanceOf(UnresolvedSubcircuitException.class);
    }
}
