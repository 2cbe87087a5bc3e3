package com.circuit.detector.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.circuit.detector.model.ElementDecl;
import com.circuit.detector.model.ElementKind;
import com.circuit.detector.model.Instance;
import com.circuit.detector.model.NetlistModel;
import com.circuit.detector.model.SubcircuitDefinition;

/**
 * Parser for SPICE-like netlists.
 * Converts classified lines into a hierarchical {@link NetlistModel}.
 *
 * Parsing only:
 * - Builds the top scope and the definition library
 * - Reports diagnostics
 *
 * It does NOT resolve instances against definitions; that happens during flattening.
 */
public class SpiceParser {
    private static final Logger log = LoggerFactory.getLogger(SpiceParser.class);

    private final List<SpiceLine> lines;
    private final String fileName;

    private final SubcircuitDefinition.SubcircuitDefinitionBuilder top =
            SubcircuitDefinition.builder().name(NetlistModel.TOP_SCOPE_NAME);
    private final Map<String, SubcircuitDefinition> definitions = new LinkedHashMap<>();

    private SubcircuitDefinition.SubcircuitDefinitionBuilder current;
    private String currentName;
    private int currentStart;

    public SpiceParser(List<SpiceLine> lines, String fileName) {
        this.lines = lines;
        this.fileName = fileName;
    }

    /**
     * Tokenize and parse in one step.
     */
    public static NetlistModel parse(String source, String fileName, ParseDiagnostics diagnostics) {
        List<SpiceLine> lines = new SpiceTokenizer(source, fileName).tokenize();
        return new SpiceParser(lines, fileName).parse(diagnostics);
    }

    public static NetlistModel parseFile(Path path, ParseDiagnostics diagnostics) throws IOException {
        String source = Files.readString(path, StandardCharsets.UTF_8);
        return parse(source, path.getFileName().toString(), diagnostics);
    }

    public NetlistModel parse(ParseDiagnostics diagnostics) {
        for (SpiceLine line : lines) {
            switch (line.getType()) {
                case SUBCKT_START -> openDefinition(line);
                case SUBCKT_END -> closeDefinition(line, diagnostics);
                case RESISTOR, CAPACITOR, COUPLING_CAPACITOR -> addElement(parseElement(line));
                case INSTANCE -> addInstance(parseInstance(line));
                case DIRECTIVE -> log.debug("{} line {}: ignoring directive {}",
                        fileName, line.getLineNumber(), line.first());
                case UNKNOWN -> unknownLine(line, diagnostics);
            }
        }

        if (current != null) {
            diagnostics.warn(fileName, currentStart,
                    "subcircuit " + currentName + " is not terminated by .ends; closing at end of file");
            log.warn("{}: unterminated subcircuit {} (opened at line {})", fileName, currentName, currentStart);
            finishDefinition(diagnostics);
        }

        NetlistModel model = new NetlistModel(top.build(), new ArrayList<>(definitions.values()));
        log.info("Parsed {}: {} top-level elements, {} top-level instances, {} subcircuit definitions",
                fileName, model.getTop().getElements().size(), model.getTop().getInstances().size(),
                model.getDefinitions().size());
        return model;
    }

    private void openDefinition(SpiceLine line) {
        if (current != null) {
            throw new SpiceParseException(fileName, line.getLineNumber(),
                    "nested .subckt inside " + currentName + " is not supported");
        }
        List<String> args = arguments(line);
        if (args.isEmpty()) {
            throw new SpiceParseException(fileName, line.getLineNumber(), ".subckt without a name");
        }
        currentName = args.get(0);
        currentStart = line.getLineNumber();
        current = SubcircuitDefinition.builder()
                .name(currentName)
                .ports(args.subList(1, args.size()));
        log.debug("Subcircuit {} opened with ports {}", currentName, args.subList(1, args.size()));
    }

    private void closeDefinition(SpiceLine line, ParseDiagnostics diagnostics) {
        if (current == null) {
            throw new SpiceParseException(fileName, line.getLineNumber(), ".ends without a matching .subckt");
        }
        List<String> args = arguments(line);
        if (!args.isEmpty() && !NetlistModel.normalizeName(args.get(0)).equals(NetlistModel.normalizeName(currentName))) {
            diagnostics.warn(fileName, line.getLineNumber(),
                    ".ends " + args.get(0) + " closes subcircuit " + currentName);
        }
        finishDefinition(diagnostics);
    }

    private void finishDefinition(ParseDiagnostics diagnostics) {
        SubcircuitDefinition definition = current.build();
        String key = NetlistModel.normalizeName(definition.getName());
        if (definitions.containsKey(key)) {
            diagnostics.warn(fileName, currentStart,
                    "subcircuit " + definition.getName() + " is defined more than once; the last definition wins");
            definitions.remove(key);
        }
        definitions.put(key, definition);
        current = null;
        currentName = null;
    }

    private void addElement(ElementDecl element) {
        if (current != null) {
            current.element(element);
        } else {
            top.element(element);
        }
    }

    private void addInstance(Instance instance) {
        if (current != null) {
            current.instance(instance);
        } else {
            top.instance(instance);
        }
    }

    private void unknownLine(SpiceLine line, ParseDiagnostics diagnostics) {
        if (current != null) {
            throw new SpiceParseException(fileName, line.getLineNumber(),
                    "unsupported element '" + line.first() + "' in subcircuit " + currentName);
        }
        diagnostics.warn(fileName, line.getLineNumber(), "skipping unsupported line: " + line.text());
        log.debug("{} line {}: skipping {}", fileName, line.getLineNumber(), line.text());
    }

    ElementDecl parseElement(SpiceLine line) {
        ElementKind kind = ElementKind.fromElementName(line.first())
                .orElseThrow(() -> new SpiceParseException(fileName, line.getLineNumber(),
                        "not an element: " + line.first()));

        List<String> args = arguments(line);
        Double value = null;
        List<String> terminals = args;
        if (args.size() > kind.terminalCount()) {
            Optional<Double> parsed = SpiceValueParser.tryParse(args.get(args.size() - 1));
            if (parsed.isPresent()) {
                value = parsed.get();
                terminals = args.subList(0, args.size() - 1);
            }
        }

        return ElementDecl.builder()
                .name(line.first())
                .kind(kind)
                .terminals(terminals)
                .value(value)
                .sourceLine(line.getLineNumber())
                .build();
    }

    Instance parseInstance(SpiceLine line) {
        List<String> args = arguments(line);
        if (args.isEmpty()) {
            throw new SpiceParseException(fileName, line.getLineNumber(),
                    "instance " + line.first() + " does not name a subcircuit");
        }
        return Instance.builder()
                .name(line.first())
                .definitionName(args.get(args.size() - 1))
                .connections(args.subList(0, args.size() - 1))
                .sourceLine(line.getLineNumber())
                .build();
    }

    /**
     * Tokens after the first, without {@code key=value} parameters.
     */
    private static List<String> arguments(SpiceLine line) {
        List<String> tokens = line.getTokens();
        return tokens.subList(1, tokens.size()).stream()
                .filter(t -> !t.contains("="))
                .toList();
    }
}
