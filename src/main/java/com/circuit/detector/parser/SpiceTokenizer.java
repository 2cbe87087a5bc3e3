package com.circuit.detector.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.circuit.detector.parser.SpiceLine.LineType;

/**
 * Splits SPICE netlist source into classified logical lines.
 *
 * Handles comment lines ({@code *}), continuation lines ({@code +}) and blank lines. Line numbers
 * refer to the first physical line of each logical line.
 */
public class SpiceTokenizer {
    private static final Logger log = LoggerFactory.getLogger(SpiceTokenizer.class);

    private final String source;
    private final String fileName;

    public SpiceTokenizer(String source, String fileName) {
        this.source = source == null ? "" : source;
        this.fileName = fileName;
    }

    /**
     * Tokenize the entire source.
     */
    public List<SpiceLine> tokenize() {
        List<SpiceLine> lines = new ArrayList<>();

        StringBuilder current = null;
        int currentLine = 0;
        String[] physical = source.split("\\r?\\n", -1);

        for (int i = 0; i < physical.length; i++) {
            String text = physical[i].strip();
            if (text.isEmpty() || text.startsWith("*")) {
                continue;
            }

            if (text.startsWith("+")) {
                String continuation = text.substring(1).strip();
                if (current == null) {
                    log.warn("{} line {}: continuation without a preceding line", fileName, i + 1);
                    current = new StringBuilder(continuation);
                    currentLine = i + 1;
                } else {
                    current.append(' ').append(continuation);
                }
                continue;
            }

            if (current != null) {
                addLine(lines, current.toString(), currentLine);
            }
            current = new StringBuilder(text);
            currentLine = i + 1;
        }

        if (current != null) {
            addLine(lines, current.toString(), currentLine);
        }

        log.debug("Tokenized {}: {} logical lines", fileName, lines.size());
        return lines;
    }

    private void addLine(List<SpiceLine> lines, String text, int lineNumber) {
        List<String> tokens = Arrays.stream(text.strip().split("\\s+"))
                .filter(t -> !t.isEmpty())
                .toList();
        if (tokens.isEmpty()) {
            return;
        }
        lines.add(new SpiceLine(classify(tokens.get(0)), tokens, lineNumber));
    }

    static LineType classify(String firstToken) {
        String token = firstToken.toLowerCase(Locale.ROOT);
        if (token.equals(".subckt")) {
            return LineType.SUBCKT_START;
        }
        if (token.equals(".ends")) {
            return LineType.SUBCKT_END;
        }
        if (token.startsWith(".")) {
            return LineType.DIRECTIVE;
        }
        // cc* must win over c*
        if (token.startsWith("cc")) {
            return LineType.COUPLING_CAPACITOR;
        }
        return switch (token.charAt(0)) {
            case 'c' -> LineType.CAPACITOR;
            case 'r' -> LineType.RESISTOR;
            case 'x' -> LineType.INSTANCE;
            default -> LineType.UNKNOWN;
        };
    }
}
