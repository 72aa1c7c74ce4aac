// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return Main.run(args,
                        new PrintStream(out, true, StandardCharsets.UTF_8),
                        new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() { return out.toString(StandardCharsets.UTF_8); }

    private String err() { return err.toString(StandardCharsets.UTF_8); }

    @Test
    void testCompile() {
        assertEquals(0, run("src/test/files/cosine.metric", "src/test/files/metric.c"));
        assertTrue(out().startsWith("/* cosine.c implements the cosine metric"), out());
        assertTrue(out().contains("/* METRIC_NAME */ cosine ()"), out());
        assertEquals("", err());
    }

    @Test
    void testVersion() {
        assertEquals(0, run("--version"));
        assertEquals("vespa-metric-compiler version 0.2\n", out().replace("\r\n", "\n"));
    }

    @Test
    void testHelp() {
        assertEquals(0, run("-h"));
        assertTrue(out().contains("Quantities available in post():"), out());
    }

    @Test
    void testDebug() {
        assertEquals(0, run("--debug", "src/test/files/okapi.metric", "src/test/files/missing.c"));
        assertTrue(out().startsWith("metric okapi\n"), out());
        assertFalse(out().contains("implements the"));
        assertEquals("", err());
    }

    @Test
    void testDebugStillNeedsTwoFiles() {
        assertEquals(2, run("--debug", "src/test/files/okapi.metric"));
        assertEquals("", out());
        assertTrue(err().contains("usage: vespa-metric-compiler"), err());
    }

    @Test
    void testCompileErrorGivesNoOutput() {
        assertEquals(2, run("src/test/files/const-assign.metric", "src/test/files/metric.c"));
        assertEquals("", out());
        assertEquals("src/test/files/const-assign.metric:4: assigning to const quantity", err().strip());
    }

    @Test
    void testUsageError() {
        assertEquals(2, run("src/test/files/cosine.metric"));
        assertEquals("", out());
        assertTrue(err().startsWith("Failed to parse command line arguments: Expected a description file and a template file."), err());
        assertTrue(err().contains("usage: vespa-metric-compiler [options] <description-file> <template-file>"), err());
    }

    @Test
    void testMissingFile() {
        assertEquals(2, run("src/test/files/missing.metric", "src/test/files/metric.c"));
        assertEquals("", out());
        assertTrue(err().contains("Could not read 'src/test/files/missing.metric'"), err());
    }

}
