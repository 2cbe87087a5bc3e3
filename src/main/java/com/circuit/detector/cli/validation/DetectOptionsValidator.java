package com.circuit.detector.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.circuit.detector.analyzer.DefectKind;
import com.circuit.detector.cli.exception.OptionsValidationException;
import com.circuit.detector.cli.model.DetectOptions;
import com.circuit.detector.cli.model.ValidatedDetectOptions;

public class DetectOptionsValidator {

	public ValidatedDetectOptions validate(DetectOptions o) {
		List<String> errors = new ArrayList<>();

		Path netlistPath = null;
		if (o.getNetlist() == null) {
			errors.add("A netlist file is required.");
		} else {
			netlistPath = o.getNetlist().toAbsolutePath().normalize();
			if (!Files.exists(netlistPath)) {
				errors.add("Netlist file does not exist: " + o.getNetlist());
			} else if (!Files.isRegularFile(netlistPath)) {
				errors.add("Netlist path is not a regular file: " + o.getNetlist());
			}
		}

		if (o.isVerbose() && o.isQuiet()) {
			errors.add("--verbose and --quiet cannot be used together.");
		}

		if (!isBlank(o.getSubcircuitName()) && !o.isSubcircuitOnly()) {
			errors.add("--subcircuit-name requires --subcircuit-only.");
		}

		checkOutput(o.getJsonOutput(), "JSON", errors);
		checkOutput(o.getTextOutput(), "Text", errors);
		if (o.getJsonOutput() != null && o.getTextOutput() != null
				&& samePath(o.getJsonOutput(), o.getTextOutput())) {
			errors.add("JSON and text reports cannot be written to the same file: " + o.getJsonOutput());
		}

		Set<DefectKind> disabled = o.getDisabledRules() == null || o.getDisabledRules().isEmpty()
				? EnumSet.noneOf(DefectKind.class)
				: EnumSet.copyOf(o.getDisabledRules());
		if (disabled.size() == DefectKind.values().length) {
			errors.add("All detection rules are disabled; nothing to check.");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedDetectOptions(netlistPath, disabled);
	}

	private static void checkOutput(Path output, String label, List<String> errors) {
		if (output != null && Files.isDirectory(output)) {
			errors.add(label + " output path is a directory: " + output);
		}
	}

	private static boolean samePath(Path a, Path b) {
		return a.toAbsolutePath().normalize().equals(b.toAbsolutePath().normalize());
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
