package com.circuit.detector.analyzer;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One detected defect. Holds names only, never references into the graph.
 */
@Value
@Builder
public class Finding {
    @NonNull
    DefectKind kind;
    @NonNull
    Severity severity;
    /** Primary subject: a node name, a component label or an instance port. */
    @NonNull
    String subject;
    @Singular
    List<String> nodes;
    @Singular
    List<String> elements;
    @NonNull
    String description;

    public static FindingBuilder of(DefectKind kind) {
        return Finding.builder()
                .kind(kind)
                .severity(kind.getDefaultSeverity());
    }
}
