package com.circuit.detector.cli.output;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.circuit.detector.analyzer.Finding;
import com.circuit.detector.cli.model.DetectOptions;
import com.circuit.detector.cli.model.ValidatedDetectOptions;
import com.circuit.detector.detector.DetectionResult;
import com.circuit.detector.report.NetlistSummary;
import com.circuit.detector.report.ReportGenerator;

/**
 * Responsible only for printing CLI output for the detect command.
 * No validation, no execution.
 */
public class DetectResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(DetectResultsPrinter.class);

    public void printBanner(DetectOptions o, ValidatedDetectOptions v) {
        log.info("=================================================");
        log.info("{} v{}", ReportGenerator.TOOL_NAME, ReportGenerator.TOOL_VERSION);
        log.info("=================================================");
        log.info("Netlist: {}", v.getNetlistPath());
        log.info("Mode: {}", o.isSubcircuitOnly()
                ? "subcircuit " + (o.getSubcircuitName() != null ? o.getSubcircuitName() : "(first definition)")
                : "top level");
        log.info("JSON Report: {}", o.getJsonOutput() != null ? o.getJsonOutput().toAbsolutePath() : "None");
        log.info("Text Report: {}", o.getTextOutput() != null ? o.getTextOutput().toAbsolutePath() : "None");
        if (!v.getDisabledRules().isEmpty()) {
            log.info("Disabled Rules: {}", v.getDisabledRules());
        }
        log.info("=================================================");
    }

    public void printSummary(DetectionResult result) {
        NetlistSummary netlist = result.getNetlistSummary();

        log.info("");
        log.info("=================================================");
        log.info(result.hasBlockingFindings() ? "OPEN CIRCUITS DETECTED" : "ANALYSIS COMPLETE");
        log.info("=================================================");
        log.info("Elements: {}", netlist.getElements());
        log.info("Nodes: {}", netlist.getNodes());
        log.info("Connected Components: {} ({} resistive)", netlist.getComponents(), netlist.getResistiveComponents());
        log.info("Subcircuit Instances: {}", netlist.getInstances());
        log.info("Total Issues: {}", result.getFindings().size());

        for (Map.Entry<String, Integer> entry : result.getReport().getSummary().getIssuesBySeverity().entrySet()) {
            log.info("  {}: {}", entry.getKey().toUpperCase(), entry.getValue());
        }

        if (!result.getFindings().isEmpty()) {
            log.info("");
            for (Finding finding : result.getFindings()) {
                log.info("[{}] {} {}: {}", finding.getSeverity(), finding.getKind(), finding.getSubject(),
                        finding.getDescription());
            }
        }

        if (!result.getWarnings().isEmpty()) {
            log.info("");
            log.info("Parser Warnings: {}", result.getWarnings().size());
        }
        log.info("=================================================");
    }

    public void printFailure(DetectionResult result) {
        log.error("Detection failed: {}", result.getErrorMessage());
    }
}
