package com.circuit.detector;

import com.circuit.detector.cli.DetectCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Open Circuit Detector.
 * Reads a hierarchical SPICE netlist, flattens it and reports floating nodes, isolated
 * islands, dangling subcircuit ports and DC-floating nodes.
 */
public class DetectorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DetectCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
