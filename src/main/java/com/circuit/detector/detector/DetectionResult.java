package com.circuit.detector.detector;

import java.util.List;

import com.circuit.detector.analyzer.Finding;
import com.circuit.detector.report.AnalysisReport;
import com.circuit.detector.report.NetlistSummary;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a detection run.
 */
@Data
@Builder
public class DetectionResult {
    private boolean success;
    private String errorMessage;

    @Builder.Default
    private List<Finding> findings = List.of();
    @Builder.Default
    private List<String> warnings = List.of();
    private NetlistSummary netlistSummary;
    private AnalysisReport report;

    public boolean hasBlockingFindings() {
        return findings.stream().anyMatch(f -> f.getSeverity().isBlocking());
    }

    public static DetectionResult failure(String errorMessage) {
        return DetectionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
