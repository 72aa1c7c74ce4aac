// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.emit;

import ai.vespa.metriccompiler.model.Declaration;
import ai.vespa.metriccompiler.model.Namespace;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MacroSubstitutionTest {

    private final Namespace namespace = namespace();

    @Test
    void testMacros() {
        MacroSubstitution macros = MacroSubstitution.macros(namespace);
        assertEquals("K = (opt->u.okapi.k1) * (DOCMAP_GET_WORDS(idx->map, acc->acc.docno)) / avg_D_terms;",
                     macros.apply("K = k1 * D_terms / avg_D_terms;"));
        assertEquals(2, macros.replacements().size());
    }

    @Test
    void testContributions() {
        MacroSubstitution contributions = MacroSubstitution.contributions(namespace);
        assertEquals("K = (opt->u.okapi.k1) * (((float) avg_D_terms)) / avg_D_terms;",
                     contributions.apply("K = k1 * D_terms / avg_D_terms;"));
    }

    @Test
    void testOnlyWholeTokensAreReplaced() {
        MacroSubstitution macros = MacroSubstitution.macros(namespace);
        assertEquals("k1_scaled = D_terms2;", macros.apply("k1_scaled = D_terms2;"));
        assertEquals("x =  (opt->u.okapi.k1); /* (opt->u.okapi.k1) */", macros.apply("x =  k1; /* k1 */"));
    }

    private static Namespace namespace() {
        Namespace namespace = new Namespace("decode");
        namespace.add(new Declaration.Builder().name("k1").type("float").macro("opt->u.okapi.k1").build());
        namespace.add(new Declaration.Builder().name("D_terms").type("const unsigned int")
                                               .macro("DOCMAP_GET_WORDS(idx->map, acc->acc.docno)")
                                               .contribution("((float) avg_D_terms)").build());
        namespace.add(new Declaration.Builder().name("avg_D_terms").type("double").build());
        return namespace;
    }

}
