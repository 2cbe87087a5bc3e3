package com.circuit.detector.flatten;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.circuit.detector.flatten.exception.MalformedElementException;
import com.circuit.detector.flatten.exception.RecursiveDefinitionException;
import com.circuit.detector.flatten.exception.UnresolvedSubcircuitException;
import com.circuit.detector.model.ElementDecl;
import com.circuit.detector.model.Instance;
import com.circuit.detector.model.NetlistModel;
import com.circuit.detector.model.Node;
import com.circuit.detector.model.SubcircuitDefinition;

/**
 * Expands subcircuit instances into a single hierarchy-free element list.
 *
 * Expansion is depth-first in declaration order. Every call returns its own element and
 * binding lists which the caller concatenates; nothing is accumulated in shared state.
 * Internal nodes are renamed to {@code <instance path>/<local name>}, ports alias the node
 * bound by the enclosing scope, and ground aliases always resolve to {@link Node#GROUND}.
 */
public class Flattener {
    private static final Logger log = LoggerFactory.getLogger(Flattener.class);

    public static final String PATH_SEPARATOR = "/";

    private final NetlistModel netlist;

    public Flattener(NetlistModel netlist) {
        this.netlist = Objects.requireNonNull(netlist, "netlist");
    }

    /**
     * Flatten starting from the netlist's top-level scope.
     */
    public FlattenedNetlist flatten() {
        Expansion expansion = expand(netlist.getTop(), Scope.top(netlist.getTop().getName()), List.of());
        return toNetlist(expansion, Set.of());
    }

    /**
     * Flatten a single definition as if it were the top scope. Its ports keep their own names
     * and become the netlist's top-level ports.
     */
    public FlattenedNetlist flattenDefinition(String definitionName) {
        SubcircuitDefinition definition = netlist.findDefinition(definitionName)
                .orElseThrow(() -> new UnresolvedSubcircuitException(definitionName, NetlistModel.TOP_SCOPE_NAME));

        Scope scope = Scope.top(definition.getName());
        Set<Node> ports = new LinkedHashSet<>();
        for (String port : definition.getPorts()) {
            checkLocalName(port, definition.getName(), 0, scope);
            ports.add(scope.resolve(port));
        }

        Expansion expansion = expand(definition, scope, List.of(NetlistModel.normalizeName(definition.getName())));
        return toNetlist(expansion, ports);
    }

    private FlattenedNetlist toNetlist(Expansion expansion, Set<Node> topLevelPorts) {
        Set<Node> declared = new LinkedHashSet<>(topLevelPorts);
        declared.addAll(expansion.declaredNodes);

        FlattenedNetlist flattened = FlattenedNetlist.builder()
                .elements(expansion.elements)
                .topLevelPorts(topLevelPorts)
                .declaredNodes(declared)
                .portBindings(expansion.bindings)
                .instanceCount(expansion.instanceCount)
                .definitionCount(netlist.getDefinitions().size())
                .build();

        log.info("Flattened netlist: {} elements, {} instances, {} port bindings",
                flattened.elementCount(), flattened.getInstanceCount(), flattened.getPortBindings().size());
        return flattened;
    }

    private Expansion expand(SubcircuitDefinition definition, Scope scope, List<String> stack) {
        List<Element> elements = new ArrayList<>();
        for (ElementDecl decl : definition.getElements()) {
            elements.add(flattenElement(decl, scope));
        }

        List<Expansion> parts = new ArrayList<>();
        parts.add(new Expansion(elements, List.of(), Set.of(), 0));
        for (Instance instance : definition.getInstances()) {
            parts.add(expandInstance(instance, scope, stack));
        }
        return Expansion.concat(parts);
    }

    private Element flattenElement(ElementDecl decl, Scope scope) {
        checkLocalName(decl.getName(), decl.getName(), decl.getSourceLine(), scope);
        for (String terminal : decl.getTerminals()) {
            checkLocalName(terminal, decl.getName(), decl.getSourceLine(), scope);
        }
        int expected = decl.getKind().terminalCount();
        if (decl.getTerminals().size() != expected) {
            throw new MalformedElementException(decl.getName(), scope.label(), decl.getSourceLine(),
                    String.format("%s expects %d terminals but declares %d",
                            decl.getKind(), expected, decl.getTerminals().size()));
        }

        Element.ElementBuilder element = Element.builder()
                .name(scope.qualify(decl.getName().toLowerCase(Locale.ROOT)))
                .kind(decl.getKind())
                .value(decl.getValue())
                .instancePath(scope.path);
        for (String terminal : decl.getTerminals()) {
            element.terminal(scope.resolve(terminal));
        }
        return element.build();
    }

    private Expansion expandInstance(Instance instance, Scope parent, List<String> stack) {
        checkLocalName(instance.getName(), instance.getName(), instance.getSourceLine(), parent);
        for (String connection : instance.getConnections()) {
            checkLocalName(connection, instance.getName(), instance.getSourceLine(), parent);
        }
        String childPath = parent.qualify(instance.getName().toLowerCase(Locale.ROOT));

        SubcircuitDefinition definition = netlist.findDefinition(instance.getDefinitionName())
                .orElseThrow(() -> new UnresolvedSubcircuitException(instance.getDefinitionName(), childPath));

        String key = NetlistModel.normalizeName(definition.getName());
        int cycleStart = stack.indexOf(key);
        if (cycleStart >= 0) {
            List<String> cycle = new ArrayList<>(stack.subList(cycleStart, stack.size()));
            cycle.add(key);
            throw new RecursiveDefinitionException(cycle);
        }

        List<String> ports = definition.getPorts();
        List<String> connections = instance.getConnections();
        if (connections.size() > ports.size()) {
            throw new MalformedElementException(instance.getName(), parent.label(), instance.getSourceLine(),
                    String.format("binds %d nodes but subcircuit %s declares %d ports",
                            connections.size(), definition.getName(), ports.size()));
        }

        for (String port : ports) {
            checkLocalName(port, instance.getName(), instance.getSourceLine(), parent);
        }

        log.debug("Expanding {} ({}) with {}/{} ports bound",
                childPath, definition.getName(), connections.size(), ports.size());

        Map<String, Node> portMap = new HashMap<>();
        List<PortBinding> bindings = new ArrayList<>();
        Set<Node> declared = new LinkedHashSet<>();
        for (int i = 0; i < ports.size(); i++) {
            String port = ports.get(i);
            boolean bound = i < connections.size();
            Node node;
            if (bound) {
                node = parent.resolve(connections.get(i));
            } else if (Node.isGroundAlias(port)) {
                node = Node.GROUND;
            } else {
                node = Node.of(childPath + PATH_SEPARATOR + port);
            }

            portMap.putIfAbsent(port.toLowerCase(Locale.ROOT), node);
            declared.add(node);
            bindings.add(PortBinding.builder()
                    .instancePath(childPath)
                    .definitionName(definition.getName())
                    .portName(port)
                    .portIndex(i)
                    .node(node)
                    .bound(bound)
                    .build());
        }

        List<String> childStack = new ArrayList<>(stack);
        childStack.add(key);

        Scope child = new Scope(childPath, definition.getName(), portMap);
        Expansion own = new Expansion(List.of(), bindings, declared, 1);
        return Expansion.concat(List.of(own, expand(definition, child, childStack)));
    }

    /**
     * Raw names must not contain the hierarchy separator: {@code x1/mid} at top level and node
     * {@code mid} inside {@code x1} would flatten to the same name.
     */
    private static void checkLocalName(String name, String owner, int sourceLine, Scope scope) {
        if (name.contains(PATH_SEPARATOR)) {
            throw new MalformedElementException(owner, scope.label(), sourceLine,
                    "name '" + name + "' contains the hierarchy separator '" + PATH_SEPARATOR + "'");
        }
    }

    /**
     * Name mapping of one instantiation.
     */
    private static final class Scope {
        private final String path;
        private final String definitionName;
        private final Map<String, Node> portMap;

        private Scope(String path, String definitionName, Map<String, Node> portMap) {
            this.path = path;
            this.definitionName = definitionName;
            this.portMap = portMap;
        }

        static Scope top(String definitionName) {
            return new Scope("", definitionName, Map.of());
        }

        /**
         * Ports win over ground aliases: a port named {@code vss} is whatever the instance bound it to.
         */
        Node resolve(String localName) {
            Node port = portMap.get(localName.trim().toLowerCase(Locale.ROOT));
            if (port != null) {
                return port;
            }
            if (Node.isGroundAlias(localName)) {
                return Node.GROUND;
            }
            return Node.of(qualify(localName));
        }

        String qualify(String localName) {
            return path.isEmpty() ? localName : path + PATH_SEPARATOR + localName;
        }

        String label() {
            return path.isEmpty() ? definitionName : definitionName + " (" + path + ")";
        }
    }

    /**
     * Partial result of expanding one scope.
     */
    private static final class Expansion {
        private final List<Element> elements;
        private final List<PortBinding> bindings;
        private final Set<Node> declaredNodes;
        private final int instanceCount;

        private Expansion(List<Element> elements, List<PortBinding> bindings, Set<Node> declaredNodes,
                          int instanceCount) {
            this.elements = elements;
            this.bindings = bindings;
            this.declaredNodes = declaredNodes;
            this.instanceCount = instanceCount;
        }

        static Expansion concat(List<Expansion> parts) {
            List<Element> elements = new ArrayList<>();
            List<PortBinding> bindings = new ArrayList<>();
            Set<Node> declared = new LinkedHashSet<>();
            int instances = 0;
            for (Expansion part : parts) {
                elements.addAll(part.elements);
                bindings.addAll(part.bindings);
                declared.addAll(part.declaredNodes);
                instances += part.instanceCount;
            }
            return new Expansion(Collections.unmodifiableList(elements),
                    Collections.unmodifiableList(bindings),
                    Collections.unmodifiableSet(declared),
                    instances);
        }
    }
}
