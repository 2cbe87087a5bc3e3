package com.circuit.detector.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.circuit.detector.cli.exception.OptionsValidationException;
import com.circuit.detector.cli.model.DetectOptions;
import com.circuit.detector.cli.model.ValidatedDetectOptions;
import com.circuit.detector.cli.output.DetectResultsPrinter;
import com.circuit.detector.cli.validation.DetectOptionsValidator;
import com.circuit.detector.detector.DetectionResult;
import com.circuit.detector.detector.DetectorConfig;
import com.circuit.detector.detector.OpenCircuitDetector;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that checks a SPICE netlist for open circuits.
 *
 * Exit codes: {@value #EXIT_CLEAN} no critical or error findings, {@value #EXIT_DEFECTS} at least
 * one critical or error finding, {@value #EXIT_FAILURE} invalid options or an unreadable netlist.
 */
@Command(
        name = "open-circuit-detector",
        mixinStandardHelpOptions = true,
        version = "open-circuit-detector 1.0.0",
        description = "Detects floating nodes, isolated islands, dangling ports and DC-floating nodes in hierarchical SPICE netlists."
)
public class DetectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DetectCommand.class);

    public static final int EXIT_CLEAN = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_DEFECTS = 2;

    @Mixin
    private DetectOptions options;

    private final DetectOptionsValidator validator = new DetectOptionsValidator();
    private final DetectResultsPrinter printer = new DetectResultsPrinter();

    @Override
    public Integer call() {
        ValidatedDetectOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            log.error("Invalid options:");
            e.getErrors().forEach(error -> log.error("  - {}", error));
            return EXIT_FAILURE;
        }

        configureLogging(options);
        printer.printBanner(options, validated);

        DetectorConfig config = DetectorConfig.builder()
                .netlistPath(validated.getNetlistPath())
                .jsonOutput(options.getJsonOutput())
                .textOutput(options.getTextOutput())
                .subcircuitOnly(options.isSubcircuitOnly())
                .subcircuitName(options.getSubcircuitName())
                .parallel(options.isParallel())
                .disabledRules(validated.getDisabledRules())
                .build();

        DetectionResult result = new OpenCircuitDetector(config).detect();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return EXIT_FAILURE;
        }

        printer.printSummary(result);
        return result.hasBlockingFindings() ? EXIT_DEFECTS : EXIT_CLEAN;
    }

    /**
     * A null level makes the application logger inherit from logback.xml again.
     */
    private static void configureLogging(DetectOptions o) {
        Level level = o.isVerbose() ? Level.DEBUG : o.isQuiet() ? Level.WARN : null;
        if (LoggerFactory.getLogger("com.circuit.detector") instanceof ch.qos.logback.classic.Logger appLogger) {
            appLogger.setLevel(level);
        }
    }
}
