package com.circuit.detector.report;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReportMetadata {
    String toolName;
    String version;
    String timestamp;
    String netlistFile;
}
