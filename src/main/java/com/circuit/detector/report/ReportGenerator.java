package com.circuit.detector.report;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.circuit.detector.analyzer.DefectKind;
import com.circuit.detector.analyzer.Finding;
import com.circuit.detector.analyzer.Severity;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Builds {@link AnalysisReport}s and renders them as JSON or plain text.
 */
public class ReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(ReportGenerator.class);

    public static final String TOOL_NAME = "Open Circuit Detector";
    public static final String TOOL_VERSION = "1.0.0";
    public static final String TEXT_TEMPLATE = "report.txt.ftl";

    private static final Comparator<Finding> REPORT_ORDER = Comparator
            .comparing(Finding::getSeverity)
            .thenComparing(Finding::getKind);

    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final Configuration freemarkerConfig;

    public ReportGenerator() {
        this(Clock.systemDefaultZone());
    }

    public ReportGenerator(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setNumberFormat("computer");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public AnalysisReport build(List<Finding> findings, NetlistSummary netlist, String netlistFile) {
        List<Finding> ordered = findings.stream().sorted(REPORT_ORDER).toList();

        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            int count = (int) ordered.stream().filter(f -> f.getSeverity() == severity).count();
            if (count > 0) {
                bySeverity.put(severity.label(), count);
            }
        }

        Map<String, Integer> byType = new LinkedHashMap<>();
        for (DefectKind kind : DefectKind.values()) {
            int count = (int) ordered.stream().filter(f -> f.getKind() == kind).count();
            if (count > 0) {
                byType.put(kind.name(), count);
            }
        }

        ReportMetadata metadata = ReportMetadata.builder()
                .toolName(TOOL_NAME)
                .version(TOOL_VERSION)
                .timestamp(OffsetDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS)
                        .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME))
                .netlistFile(netlistFile)
                .build();

        ReportSummary summary = ReportSummary.builder()
                .totalIssues(ordered.size())
                .issuesBySeverity(bySeverity)
                .issuesByType(byType)
                .netlist(netlist)
                .build();

        return AnalysisReport.builder()
                .metadata(metadata)
                .summary(summary)
                .issues(ordered.stream().map(ReportIssue::from).toList())
                .build();
    }

    public String toJson(AnalysisReport report) throws IOException {
        return objectMapper.writeValueAsString(report);
    }

    public String toText(AnalysisReport report) throws IOException {
        Template template = freemarkerConfig.getTemplate(TEXT_TEMPLATE);
        StringWriter out = new StringWriter();
        try {
            template.process(Map.of("report", report), out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + TEXT_TEMPLATE + ": " + e.getMessage(), e);
        }
        return out.toString();
    }

    public void writeJson(AnalysisReport report, Path target) throws IOException {
        safeWriteString(target, toJson(report));
        log.info("JSON report written to {}", target);
    }

    public void writeText(AnalysisReport report, Path target) throws IOException {
        safeWriteString(target, toText(report));
        log.info("Text report written to {}", target);
    }

    private static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }
}
