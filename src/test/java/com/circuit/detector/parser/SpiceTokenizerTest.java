package com.circuit.detector.parser;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.circuit.detector.parser.SpiceLine.LineType;

import static org.assertj.core.api.Assertions.*;

class SpiceTokenizerTest {

    @Test
    void testSkipsCommentsAndJoinsContinuations() {
        String source = """
            * title line

            R1 a b
            + 100
            C1 b 0 1p
            """;

        List<SpiceLine> lines = new SpiceTokenizer(source, "t.sp").tokenize();

        assertThat(lines).hasSize(2);
        assertThat(lines.get(0).getTokens()).containsExactly("R1", "a", "b", "100");
        assertThat(lines.get(0).getLineNumber()).isEqualTo(3);
        assertThat(lines.get(0).getType()).isEqualTo(LineType.RESISTOR);
        assertThat(lines.get(1).getLineNumber()).isEqualTo(5);
        assertThat(lines.get(1).getType()).isEqualTo(LineType.CAPACITOR);
    }

    @Test
    void testClassify() {
        assertThat(SpiceTokenizer.classify("CC1")).isEqualTo(LineType.COUPLING_CAPACITOR);
        assertThat(SpiceTokenizer.classify("c1")).isEqualTo(LineType.CAPACITOR);
        assertThat(SpiceTokenizer.classify("r7")).isEqualTo(LineType.RESISTOR);
        assertThat(SpiceTokenizer.classify("X1")).isEqualTo(LineType.INSTANCE);
        assertThat(SpiceTokenizer.classify(".SUBCKT")).isEqualTo(LineType.SUBCKT_START);
        assertThat(SpiceTokenizer.classify(".ends")).isEqualTo(LineType.SUBCKT_END);
        assertThat(SpiceTokenizer.classify(".option")).isEqualTo(LineType.DIRECTIVE);
        assertThat(SpiceTokenizer.classify("V1")).isEqualTo(LineType.UNKNOWN);
    }

    @Test
    void testEmptySource() {
        assertThat(new SpiceTokenizer("", "t.sp").tokenize()).isEmpty();
        assertThat(new SpiceTokenizer(null, "t.sp").tokenize()).isEmpty();
    }
}
