package com.circuit.detector.detector;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.circuit.detector.analyzer.Finding;
import com.circuit.detector.analyzer.OpenCircuitAnalyzer;
import com.circuit.detector.flatten.FlattenedNetlist;
import com.circuit.detector.flatten.Flattener;
import com.circuit.detector.flatten.exception.NetlistStructureException;
import com.circuit.detector.graph.ConnectivityGraph;
import com.circuit.detector.model.NetlistModel;
import com.circuit.detector.model.SubcircuitDefinition;
import com.circuit.detector.parser.ParseDiagnostics;
import com.circuit.detector.parser.SpiceParseException;
import com.circuit.detector.parser.SpiceParser;
import com.circuit.detector.report.AnalysisReport;
import com.circuit.detector.report.NetlistSummary;
import com.circuit.detector.report.ReportGenerator;

/**
 * Runs the whole pipeline: parse, flatten, build the graph, analyze, report.
 */
public class OpenCircuitDetector {
    private static final Logger log = LoggerFactory.getLogger(OpenCircuitDetector.class);

    private final DetectorConfig config;
    private final ReportGenerator reportGenerator;

    public OpenCircuitDetector(DetectorConfig config) {
        this(config, new ReportGenerator());
    }

    public OpenCircuitDetector(DetectorConfig config, ReportGenerator reportGenerator) {
        this.config = config;
        this.reportGenerator = reportGenerator;
    }

    /**
     * Detect defects in the configured netlist file.
     */
    public DetectionResult detect() {
        Path netlistPath = config.getNetlistPath();
        try {
            log.info("Step 1: Parsing netlist {}...", netlistPath);
            ParseDiagnostics diagnostics = new ParseDiagnostics();
            NetlistModel model = SpiceParser.parseFile(netlistPath, diagnostics);
            return detect(model, netlistPath.toString(), diagnostics);
        } catch (SpiceParseException e) {
            return DetectionResult.failure("Parse error: " + e.getMessage());
        } catch (IOException e) {
            return DetectionResult.failure("Failed to read netlist " + netlistPath + ": " + e.getMessage());
        }
    }

    /**
     * Detect defects in an already parsed netlist.
     */
    public DetectionResult detect(NetlistModel model, String netlistName, ParseDiagnostics diagnostics) {
        for (String warning : diagnostics.getWarnings()) {
            log.warn(warning);
        }
        if (config.isSubcircuitOnly() && model.getDefinitions().isEmpty()) {
            return DetectionResult.failure("No subcircuit definitions found in " + netlistName);
        }

        try {
            log.info("Step 2: Flattening hierarchy...");
            FlattenedNetlist flattened = flatten(model);

            log.info("Step 3: Building connectivity graph...");
            ConnectivityGraph graph = ConnectivityGraph.build(flattened);

            log.info("Step 4: Running detection rules...");
            OpenCircuitAnalyzer analyzer = OpenCircuitAnalyzer.withDefaultRulesExcept(
                    config.getDisabledRules(), config.isParallel());
            List<Finding> findings = analyzer.analyze(graph, flattened);

            log.info("Step 5: Generating reports...");
            NetlistSummary summary = NetlistSummary.of(graph, flattened);
            AnalysisReport report = reportGenerator.build(findings, summary, netlistName);
            if (config.getJsonOutput() != null) {
                reportGenerator.writeJson(report, config.getJsonOutput());
            }
            if (config.getTextOutput() != null) {
                reportGenerator.writeText(report, config.getTextOutput());
            }

            return DetectionResult.builder()
                    .success(true)
                    .findings(findings)
                    .warnings(List.copyOf(diagnostics.getWarnings()))
                    .netlistSummary(summary)
                    .report(report)
                    .build();
        } catch (NetlistStructureException e) {
            return DetectionResult.failure("Netlist structure error: " + e.getMessage());
        } catch (IOException e) {
            return DetectionResult.failure("Failed to write report: " + e.getMessage());
        }
    }

    private FlattenedNetlist flatten(NetlistModel model) {
        Flattener flattener = new Flattener(model);
        if (!config.isSubcircuitOnly()) {
            return flattener.flatten();
        }

        String name = config.getSubcircuitName();
        if (name == null) {
            name = model.firstDefinition()
                    .map(SubcircuitDefinition::getName)
                    .orElseThrow();
        }
        log.info("Analyzing subcircuit {} as the top scope", name);
        return flattener.flattenDefinition(name);
    }
}
