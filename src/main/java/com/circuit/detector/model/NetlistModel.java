package com.circuit.detector.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;
import lombok.NonNull;

/**
 * Hierarchical netlist: a top-level scope plus the library of subcircuit definitions.
 * Definition lookup is case-insensitive.
 */
@Getter
public class NetlistModel {

    public static final String TOP_SCOPE_NAME = "<top>";

    private final SubcircuitDefinition top;
    private final Map<String, SubcircuitDefinition> definitions;

    public NetlistModel(@NonNull SubcircuitDefinition top, @NonNull List<SubcircuitDefinition> definitions) {
        this.top = top;
        Map<String, SubcircuitDefinition> byName = new LinkedHashMap<>();
        for (SubcircuitDefinition definition : definitions) {
            byName.put(normalizeName(definition.getName()), definition);
        }
        this.definitions = Collections.unmodifiableMap(byName);
    }

    /**
     * A netlist whose top scope holds the given elements and instances and has no ports.
     */
    public static NetlistModel of(List<ElementDecl> topElements, List<Instance> topInstances,
                                  List<SubcircuitDefinition> definitions) {
        SubcircuitDefinition top = SubcircuitDefinition.builder()
                .name(TOP_SCOPE_NAME)
                .elements(topElements)
                .instances(topInstances)
                .build();
        return new NetlistModel(top, definitions);
    }

    public Optional<SubcircuitDefinition> findDefinition(String name) {
        return Optional.ofNullable(definitions.get(normalizeName(name)));
    }

    public Optional<SubcircuitDefinition> firstDefinition() {
        return definitions.values().stream().findFirst();
    }

    public static String normalizeName(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
