package com.circuit.detector.cli.model;

import java.nio.file.Path;
import java.util.Set;

import com.circuit.detector.analyzer.DefectKind;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps DetectCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedDetectOptions {
    Path netlistPath;
    Set<DefectKind> disabledRules;
}
