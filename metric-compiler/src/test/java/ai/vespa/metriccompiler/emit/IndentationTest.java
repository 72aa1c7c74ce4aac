// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.emit;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IndentationTest {

    @Test
    void testDedentAndIndent() {
        String code = "        if (x) {\n" +
                      "            return y;\n" +
                      "\n" +
                      "        }";
        String dedented = Indentation.dedent(code);
        assertEquals("if (x) {\n    return y;\n\n}", dedented);
        assertEquals("  if (x) {\n      return y;\n  \n  }", Indentation.indent(dedented, 2));
        assertEquals("   ", Indentation.dedent("   "));
    }

    @Test
    void testSpacesAndLeadingWhitespace() {
        assertEquals("", Indentation.spaces(-4));
        assertEquals("    ", Indentation.spaces(4));
        assertEquals(4, Indentation.leadingWhitespace("    /* METRIC_PRE */\n"));
        assertEquals(0, Indentation.leadingWhitespace("x"));
    }

    @Test
    void testLinesKeepTerminators() {
        assertEquals(List.of("a\n", "\n", "b"), Indentation.linesWithTerminators("a\n\nb"));
        assertEquals(List.of("a\r\n"), Indentation.linesWithTerminators("a\r\n"));
        assertTrue(Indentation.linesWithTerminators("").isEmpty());
    }

}
