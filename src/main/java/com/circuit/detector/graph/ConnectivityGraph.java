package com.circuit.detector.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.circuit.detector.flatten.Element;
import com.circuit.detector.flatten.FlattenedNetlist;
import com.circuit.detector.model.EdgeKind;
import com.circuit.detector.model.Node;

/**
 * Immutable connectivity view of a flattened netlist.
 *
 * Resistors form the DC (resistive) edge set, capacitors and coupling capacitors the AC-only
 * (capacitive) edge set; {@link EdgeKind#ANY} is their union. Every node named by an element
 * terminal or a declaration is a vertex, even with degree zero. Components are computed once,
 * at build time, so the graph can be shared by concurrently running rules.
 */
public final class ConnectivityGraph {
    private static final Logger log = LoggerFactory.getLogger(ConnectivityGraph.class);

    private final Set<Node> nodes;
    private final List<Element> elements;
    private final Map<EdgeKind, Map<Node, Set<Node>>> adjacency;
    private final Map<EdgeKind, Map<Node, Integer>> degrees;
    private final Map<Node, List<Element>> incidentElements;
    private final Map<EdgeKind, List<ConnectedComponent>> components;
    private final Map<EdgeKind, Map<Node, ConnectedComponent>> componentByNode;
    private final int incidenceCount;

    private ConnectivityGraph(Set<Node> nodes, List<Element> elements,
                              Map<EdgeKind, Map<Node, Set<Node>>> adjacency,
                              Map<EdgeKind, Map<Node, Integer>> degrees,
                              Map<Node, List<Element>> incidentElements,
                              int incidenceCount) {
        this.nodes = Collections.unmodifiableSet(nodes);
        this.elements = List.copyOf(elements);
        this.adjacency = adjacency;
        this.degrees = degrees;
        this.incidentElements = incidentElements;
        this.incidenceCount = incidenceCount;
        this.components = new EnumMap<>(EdgeKind.class);
        this.componentByNode = new EnumMap<>(EdgeKind.class);
        for (EdgeKind kind : EdgeKind.values()) {
            List<ConnectedComponent> found = traverse(kind);
            Map<Node, ConnectedComponent> index = new HashMap<>();
            for (ConnectedComponent component : found) {
                for (Node node : component.getNodes()) {
                    index.put(node, component);
                }
            }
            components.put(kind, found);
            componentByNode.put(kind, index);
        }
    }

    /**
     * Build the graph. The netlist is only read.
     */
    public static ConnectivityGraph build(FlattenedNetlist netlist) {
        Set<Node> nodes = new LinkedHashSet<>();
        Map<EdgeKind, Map<Node, Set<Node>>> adjacency = new EnumMap<>(EdgeKind.class);
        Map<EdgeKind, Map<Node, Integer>> degrees = new EnumMap<>(EdgeKind.class);
        for (EdgeKind kind : EdgeKind.values()) {
            adjacency.put(kind, new HashMap<>());
            degrees.put(kind, new HashMap<>());
        }
        Map<Node, List<Element>> incident = new LinkedHashMap<>();
        int incidences = 0;

        for (Element element : netlist.getElements()) {
            EdgeKind edgeKind = element.edgeKind();
            List<Node> terminals = element.getTerminals();

            for (Node terminal : terminals) {
                nodes.add(terminal);
                incidences++;
                degrees.get(edgeKind).merge(terminal, 1, Integer::sum);
                degrees.get(EdgeKind.ANY).merge(terminal, 1, Integer::sum);

                List<Element> touching = incident.computeIfAbsent(terminal, n -> new ArrayList<>());
                if (touching.isEmpty() || touching.get(touching.size() - 1) != element) {
                    touching.add(element);
                }
            }

            for (int i = 0; i < terminals.size(); i++) {
                for (int j = i + 1; j < terminals.size(); j++) {
                    link(adjacency.get(edgeKind), terminals.get(i), terminals.get(j));
                    link(adjacency.get(EdgeKind.ANY), terminals.get(i), terminals.get(j));
                }
            }
        }

        nodes.addAll(netlist.getDeclaredNodes());

        ConnectivityGraph graph = new ConnectivityGraph(nodes, netlist.getElements(), adjacency, degrees,
                incident, incidences);
        log.info("Connectivity graph: {} nodes, {} elements, {} components ({} resistive)",
                graph.nodes.size(), graph.elements.size(),
                graph.connectedComponents(EdgeKind.ANY).size(),
                graph.connectedComponents(EdgeKind.RESISTIVE).size());
        return graph;
    }

    private static void link(Map<Node, Set<Node>> adjacency, Node a, Node b) {
        adjacency.computeIfAbsent(a, n -> new LinkedHashSet<>()).add(b);
        adjacency.computeIfAbsent(b, n -> new LinkedHashSet<>()).add(a);
    }

    private List<ConnectedComponent> traverse(EdgeKind kind) {
        Map<Node, Set<Node>> edges = adjacency.get(kind);
        Set<Node> visited = new HashSet<>();
        List<ConnectedComponent> found = new ArrayList<>();

        for (Node start : nodes) {
            if (!visited.add(start)) {
                continue;
            }
            Set<Node> members = new LinkedHashSet<>();
            Deque<Node> queue = new ArrayDeque<>();
            queue.add(start);
            while (!queue.isEmpty()) {
                Node current = queue.poll();
                members.add(current);
                for (Node next : edges.getOrDefault(current, Set.of())) {
                    if (visited.add(next)) {
                        queue.add(next);
                    }
                }
            }
            found.add(new ConnectedComponent(found.size(), kind, Collections.unmodifiableSet(members)));
        }
        return Collections.unmodifiableList(found);
    }

    public Set<Node> nodes() {
        return nodes;
    }

    public List<Element> elements() {
        return elements;
    }

    public boolean contains(Node node) {
        return nodes.contains(node);
    }

    /**
     * Number of element terminals of the given kind touching {@code node}. Zero for unknown nodes.
     */
    public int degree(Node node, EdgeKind kind) {
        return degrees.get(kind).getOrDefault(node, 0);
    }

    public Set<Node> neighbors(Node node, EdgeKind kind) {
        return Collections.unmodifiableSet(adjacency.get(kind).getOrDefault(node, Set.of()));
    }

    /**
     * Distinct elements of the given kind touching {@code node}, in netlist order.
     */
    public List<Element> incidentElements(Node node, EdgeKind kind) {
        return incidentElements.getOrDefault(node, List.of()).stream()
                .filter(e -> kind.includes(e.edgeKind()))
                .toList();
    }

    public List<ConnectedComponent> connectedComponents(EdgeKind kind) {
        return components.get(kind);
    }

    public Optional<ConnectedComponent> componentOf(Node node, EdgeKind kind) {
        return Optional.ofNullable(componentByNode.get(kind).get(node));
    }

    /**
     * Ground itself always has a ground path; a node outside the graph never does.
     */
    public boolean hasGroundPath(Node node, EdgeKind kind) {
        if (node.isGround()) {
            return true;
        }
        return componentOf(node, kind)
                .map(ConnectedComponent::containsGround)
                .orElse(false);
    }

    public List<Node> isolatedNodes() {
        return nodes.stream()
                .filter(n -> degree(n, EdgeKind.ANY) == 0)
                .toList();
    }

    /**
     * Elements whose terminals all lie in the component.
     */
    public List<Element> elementsWithin(ConnectedComponent component) {
        return elements.stream()
                .filter(e -> component.getEdgeKind().includes(e.edgeKind()))
                .filter(e -> e.getTerminals().stream().allMatch(component::contains))
                .toList();
    }

    /**
     * Total (node, element) incidences; twice the element count for two-terminal elements.
     */
    public int incidenceCount() {
        return incidenceCount;
    }
}
