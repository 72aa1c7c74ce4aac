// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.emit;

import ai.vespa.metriccompiler.MetricCompiler;
import ai.vespa.metriccompiler.model.MetricDescription;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class DebugDumpTest {

    @Test
    void testDumpOfOkapi() throws Exception {
        MetricDescription okapi = new MetricCompiler().analyze(Path.of("src/test/files/okapi.metric"));
        String dump = DebugDump.of(okapi);
        assertTrue(dump.startsWith("metric okapi\n# okapi.metric describes the Okapi BM25 metric.\n"), dump);
        assertTrue(dump.contains("parameters:\n  k1 (float)\n  k3 (float)\n  b (float)\n"), dump);
        assertTrue(dump.contains("\ndecode declarations:\n"), dump);
        assertTrue(dump.contains("  3 f_dt (const unsigned int)\n"), dump);
        assertTrue(dump.contains("  2 w_t (float) line 8\n  2 K_d (float) line 9\ndecode used:\n"), dump);
        assertTrue(dump.contains("decode used:\n  2 w_t line 8\n"), dump);
        assertFalse(dump.substring(dump.indexOf("post declarations:")).contains("f_dt ("), dump);
        assertTrue(dump.contains("  1 w_t = logf((N - f_t + 0.5) / (f_t + 0.5));\n"), dump);
        assertTrue(dump.contains("  3 accumulator += w_t"), dump);
        assertTrue(dump.contains("post statements:\n\nprerequisites:\n" +
                                 "  if (docmap_cache(idx->map, docmap_get_cache(idx->map) | DOCMAP_CACHE_WORDS) != DOCMAP_OK) return SEARCH_EINVAL;\n"),
                   dump);
    }

}
