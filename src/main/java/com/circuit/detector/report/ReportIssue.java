package com.circuit.detector.report;

import java.util.List;

import com.circuit.detector.analyzer.Finding;

import lombok.Builder;
import lombok.Value;

/**
 * A finding as it appears in rendered reports.
 */
@Value
@Builder
public class ReportIssue {
    String node;
    String type;
    String severity;
    String description;
    List<String> nodes;
    List<String> affectedElements;
    int affectedElementsCount;

    public static ReportIssue from(Finding finding) {
        return ReportIssue.builder()
                .node(finding.getSubject())
                .type(finding.getKind().name())
                .severity(finding.getSeverity().label())
                .description(finding.getDescription())
                .nodes(finding.getNodes())
                .affectedElements(finding.getElements())
                .affectedElementsCount(finding.getElements().size())
                .build();
    }
}
