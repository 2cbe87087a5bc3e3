package com.circuit.detector.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.circuit.detector.analyzer.DefectKind;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the detect command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class DetectOptions {

	@Parameters(index = "0", paramLabel = "NETLIST", description = "SPICE netlist file to analyze")
	private Path netlist;

	@Option(names = { "--output-json", "-j" }, paramLabel = "FILE", description = "Write the report as JSON")
	private Path jsonOutput;

	@Option(names = { "--output-text", "-t" }, paramLabel = "FILE", description = "Write the report as plain text")
	private Path textOutput;

	@Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
	private boolean verbose;

	@Option(names = { "--quiet", "-q" }, description = "Only log warnings and errors")
	private boolean quiet;

	@Option(names = {
			"--subcircuit-only" }, description = "Analyze a subcircuit definition on its own instead of the top level")
	private boolean subcircuitOnly;

	@Option(names = {
			"--subcircuit-name" }, paramLabel = "NAME", description = "Definition to analyze with --subcircuit-only (default: the first one)")
	private String subcircuitName;

	@Option(names = { "--parallel" }, description = "Evaluate detection rules in parallel")
	private boolean parallel;

	@Option(names = {
			"--disable-rule" }, paramLabel = "KIND", split = ",", description = "Skip a detection rule: ${COMPLETION-CANDIDATES}")
	private List<DefectKind> disabledRules = new ArrayList<>();
}
