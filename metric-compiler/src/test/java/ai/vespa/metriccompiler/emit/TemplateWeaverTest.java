// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.emit;

import ai.vespa.metriccompiler.CompilationContext;
import ai.vespa.metriccompiler.builtin.BuiltinQuantities;
import ai.vespa.metriccompiler.level.BlockLevelPropagator;
import ai.vespa.metriccompiler.model.MetricDescription;
import ai.vespa.metriccompiler.parse.MetricParser;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class TemplateWeaverTest {

    private static final Clock clock = Clock.fixed(Instant.parse("2006-06-29T04:12:41Z"), ZoneOffset.UTC);

    @Test
    void testWeavingCosine() throws Exception {
        MetricDescription cosine = analyze(Files.readString(Path.of("src/test/files/cosine.metric")), "cosine");
        String template = "/* template for\n" +
                          " * all metrics */\n" +
                          "#include \"metric.h\"\n" +
                          "static int pre() {\n" +
                          "    /* METRIC_PRE */\n" +
                          "    return 0;\n" +
                          "}\n" +
                          "static int post() {\n" +
                          "    /* METRIC_POST */\n" +
                          "    while (acc) {\n" +
                          "        /* METRIC_POST_PER_DOC */\n" +
                          "    }\n" +
                          "}\n" +
                          "    /* METRIC_DECL */\n" +
                          "    /* METRIC_PER_CALL */\n" +
                          "        /* METRIC_PER_DOC */\n" +
                          "    /*METRIC_CONTRIB*/ after\n" +
                          "int deps = /* METRIC_DEPENDS_POST */ ? 1 : 0; /* note */\n";

        String expected = "/* cosine.c implements the cosine metric for the query\n" +
                          " * subsystem.  This file was automatically generated from\n" +
                          " * cosine.metric and metric.c\n" +
                          " * by vespa-metric-compiler on Thu, 29 Jun 2006 04:12:41 GMT.\n" +
                          " *\n" +
                          " * DO NOT MODIFY THIS FILE, as changes will be lost upon\n" +
                          " * subsequent regeneration.\n" +
                          " * Go modify cosine.metric or metric.c instead.\n" +
                          " *\n" +
                          " * Comments from cosine.metric:\n" +
                          " *\n" +
                          " * cosine.metric describes the cosine metric.\n" +
                          " *\n" +
                          " * The weight of a document is the cosine of the angle between it and the query,\n" +
                          " * each term being a dimension.\n" +
                          " *\n" +
                          " */\n" +
                          "\n" +
                          "#include \"metric.h\"\n" +
                          "static int pre() {\n" +
                          "    /* METRIC_PRE */\n" +
                          "    if (docmap_cache(idx->map, docmap_get_cache(idx->map) | DOCMAP_CACHE_WEIGHT) != DOCMAP_OK) return SEARCH_EINVAL;\n" +
                          "\n" +
                          "    return 0;\n" +
                          "}\n" +
                          "static int post() {\n" +
                          "    /* METRIC_POST */\n" +
                          "    const float Q_weight = search_qweight(query);\n" +
                          "\n" +
                          "    while (acc) {\n" +
                          "        /* METRIC_POST_PER_DOC */\n" +
                          "        (acc->acc.weight) /= (float) ((DOCMAP_GET_WEIGHT(idx->map, acc->acc.docno)) * Q_weight);\n" +
                          "\n" +
                          "    }\n" +
                          "}\n" +
                          "    /* METRIC_DECL */\n" +
                          "\n" +
                          "    /* METRIC_PER_CALL */\n" +
                          "\n" +
                          "        /* METRIC_PER_DOC */\n" +
                          "        (acc->acc.weight) += (1 + (float) logf((query->term[qterm].f_qt))) * (1 + (float) logf(f_dt));\n" +
                          "\n" +
                          "    /* METRIC_CONTRIB */\n" +
                          "    (acc->acc.weight) += (1 + (float) logf((query->term[qterm].f_qt))) * (1 + (float) logf(f_dt));\n" +
                          " after\n" +
                          "int deps = /* METRIC_DEPENDS_POST */ 1 ? 1 : 0; /* note */\n";

        assertEquals(expected, weave(cosine, template));
    }

    @Test
    void testMetricNameAndUntouchedBytes() throws Exception {
        MetricDescription bm25 = analyze("decode() {\n    accumulator += f_dt;\n}\n", "bm25");
        String body = "\r\n" +
                      "const struct search_metric * /* METRIC_NAME */ () {\n" +
                      "\treturn   &sm ;  \n" +
                      "}";
        String output = weave(bm25, "/* header */\n" + body);
        assertTrue(output.startsWith("/* bm25.c implements the bm25 metric for the query\n"));
        assertFalse(output.contains("Comments from"));
        assertTrue(output.endsWith(" */\n\n" + body.replace("/* METRIC_NAME */", "/* METRIC_NAME */ bm25")), output);
    }

    @Test
    void testBlockIndentationAndDeclarations() throws Exception {
        MetricDescription metric = analyze("parameter float k1 = 1.2;\n" +
                                           "decode() {\n" +
                                           "    float x = k1 * 2;\n" +
                                           "    int i;\n" +
                                           "    float *p;\n" +
                                           "    x = 0;\n" +
                                           "    p = 0;\n" +
                                           "    while (i < dterms) {\n" +
                                           "        x += D_terms;\n" +
                                           "    }\n" +
                                           "    accumulator += x * f_dt;\n" +
                                           "}\n", "m");
        String template = "/* */\n" +
                          "  /* METRIC_DECL */\n" +
                          "  /* METRIC_PER_CALL */\n" +
                          "      /* METRIC_PER_DOC */\n" +
                          "      /* METRIC_CONTRIB */\n";
        String output = weave(metric, template);
        String code = output.substring(output.indexOf("  /* METRIC_DECL */"));
        assertEquals("  /* METRIC_DECL */\n" +
                     "  const unsigned int dterms = iobtree_size(idx->vocab);\n" +
                     "  double avg_D_terms;\n" +
                     "  float x = (opt->u.m.k1) * 2;\n" +
                     "  int i;\n" +
                     "  float *p;\n" +
                     "  if (docmap_avg_words(idx->map, &avg_D_terms) != DOCMAP_OK) {\n" +
                     "      return SEARCH_EINVAL;\n" +
                     "  }\n" +
                     "\n" +
                     "  /* METRIC_PER_CALL */\n" +
                     "  x = 0;\n" +
                     "  p = 0;\n" +
                     "\n" +
                     "      /* METRIC_PER_DOC */\n" +
                     "      while (i < dterms) {\n" +
                     "          x += (DOCMAP_GET_WORDS(idx->map, acc->acc.docno));\n" +
                     "      }\n" +
                     "      (acc->acc.weight) += x * f_dt;\n" +
                     "\n" +
                     "      /* METRIC_CONTRIB */\n" +
                     "      while (i < dterms) {\n" +
                     "          x += (((float) avg_D_terms));\n" +
                     "      }\n" +
                     "      (acc->acc.weight) += x * f_dt;\n" +
                     "\n",
                     code);
    }

    @Test
    void testTemplateWithoutMarkers() throws Exception {
        MetricDescription metric = analyze("post() {\n}\n", "empty");
        String output = weave(metric, "/* only a header */");
        assertTrue(output.endsWith(" */\n\n"));
        assertEquals(output, weave(metric, "/* only a header */"));
    }

    private static MetricDescription analyze(String description, String name) throws Exception {
        MetricDescription metric = new MetricParser(new CompilationContext(name + ".metric"), BuiltinQuantities.standard())
                .parse(new StringReader(description), name);
        new BlockLevelPropagator().propagate(metric.decode().statements());
        new BlockLevelPropagator().propagate(metric.post().statements());
        return metric;
    }

    private static String weave(MetricDescription metric, String template) {
        return new TemplateWeaver(metric, new GeneratedHeader(metric.name() + ".metric", "metric.c", clock)).weave(template);
    }

}
