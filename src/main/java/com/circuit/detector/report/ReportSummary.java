package com.circuit.detector.report;

import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * Finding counts. Severity keys are lower-case labels, type keys defect kind names, most severe first.
 */
@Value
@Builder
public class ReportSummary {
    int totalIssues;
    Map<String, Integer> issuesBySeverity;
    Map<String, Integer> issuesByType;
    NetlistSummary netlist;
}
