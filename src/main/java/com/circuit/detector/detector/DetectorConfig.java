package com.circuit.detector.detector;

import java.nio.file.Path;
import java.util.Set;

import com.circuit.detector.analyzer.DefectKind;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one detection run.
 */
@Data
@Builder
public class DetectorConfig {
    private Path netlistPath;
    private Path jsonOutput;
    private Path textOutput;

    /** Analyze a single definition as the top scope instead of the netlist's top level. */
    private boolean subcircuitOnly;
    /** Definition to analyze in subcircuit-only mode; the first definition when null. */
    private String subcircuitName;

    private boolean parallel;
    @Builder.Default
    private Set<DefectKind> disabledRules = Set.of();
}
