package com.circuit.detector.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.circuit.detector.analyzer.DefectKind;
import com.circuit.detector.cli.exception.OptionsValidationException;
import com.circuit.detector.cli.model.DetectOptions;
import com.circuit.detector.cli.model.ValidatedDetectOptions;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

class DetectOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private Path netlist;
    private final DetectOptionsValidator validator = new DetectOptionsValidator();

    @BeforeEach
    void setUp() throws IOException {
        netlist = Files.writeString(tempDir.resolve("top.sp"), "r1 a 0 1k\n");
    }

    private static DetectOptions options(String... args) {
        return CommandLine.populateCommand(new DetectOptions(), args);
    }

    @Test
    void testValidOptions() {
        ValidatedDetectOptions validated = validator.validate(
                options(netlist.toString(), "--disable-rule", "UNUSED_PORT,FLOATING_PORT"));

        assertThat(validated.getNetlistPath()).isAbsolute().isEqualTo(netlist.toAbsolutePath().normalize());
        assertThat(validated.getDisabledRules())
                .containsExactlyInAnyOrder(DefectKind.UNUSED_PORT, DefectKind.FLOATING_PORT);
    }

    @Test
    void testAllErrorsAreCollected() {
        DetectOptions o = options(tempDir.resolve("missing.sp").toString(), "-v", "-q",
                "--subcircuit-name", "cell", "-j", tempDir.toString());

        assertThatThrownBy(() -> validator.validate(o))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(4)
                        .anyMatch(m -> m.contains("does not exist"))
                        .anyMatch(m -> m.contains("--verbose and --quiet"))
                        .anyMatch(m -> m.contains("--subcircuit-name requires --subcircuit-only"))
                        .anyMatch(m -> m.contains("is a directory")));
    }

    @Test
    void testDirectoryIsNotANetlist() {
        assertThatThrownBy(() -> validator.validate(options(tempDir.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("not a regular file");
    }

    @Test
    void testReportsMustGoToDifferentFiles() {
        Path out = tempDir.resolve("report.out");

        assertThatThrownBy(() -> validator.validate(options(netlist.toString(), "-j", out.toString(), "-t", out.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("same file");
    }

    @Test
    void testCannotDisableEveryRule() {
        String all = String.join(",", Arrays.stream(DefectKind.values()).map(Enum::name).toList());

        assertThatThrownBy(() -> validator.validate(options(netlist.toString(), "--disable-rule", all)))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("All detection rules are disabled");
    }
}
