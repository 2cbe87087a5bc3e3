package com.circuit.detector.report;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Everything a rendered report shows. Issues are ordered by severity, then defect kind.
 */
@Value
@Builder
public class AnalysisReport {
    ReportMetadata metadata;
    ReportSummary summary;
    @Singular
    List<ReportIssue> issues;

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
