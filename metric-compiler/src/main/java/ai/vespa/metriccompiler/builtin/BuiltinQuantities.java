// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.builtin;

import ai.vespa.metriccompiler.MetricCompileException;
import ai.vespa.metriccompiler.model.Level;
import ai.vespa.metriccompiler.model.Scope;
import ai.vespa.metriccompiler.parse.DeclarationParser;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The catalog of quantities every metric may use without declaring them.
 *
 * @see #standard()
 *
 * @author mcomp
 */
public class BuiltinQuantities {

    private static final BuiltinQuantities standard = new BuiltinQuantities(ImmutableList.of(
            BuiltinQuantity.withMacro("const unsigned int f_t;", Level.CONSTANT, "query->term[qterm].f_t",
                                      "number of documents in collection term occurs in").onlyInDecode(),
            BuiltinQuantity.withMacro("const unsigned int F_t;", Level.CONSTANT, "query->term[qterm].F_t",
                                      "number of times term occurs in collection").onlyInDecode(),
            BuiltinQuantity.of("const unsigned int f_dt;", Level.TERM,
                               "number of times term occurs in current document").onlyInDecode(),
            BuiltinQuantity.withMacro("float accumulator;", Level.DOCUMENT, "acc->acc.weight",
                                      "accumulated score of document"),
            BuiltinQuantity.of("const unsigned int dterms = iobtree_size(idx->vocab);", Level.CONSTANT,
                               "number of distinct terms in the collection"),
            BuiltinQuantity.of("const double terms = ((double) UINT_MAX) * idx->stats.terms_high + idx->stats.terms_low;",
                               Level.CONSTANT, "number of terms in the collection"),
            BuiltinQuantity.of("const unsigned int N = docmap_entries(idx->map);", Level.CONSTANT,
                               "number of documents in the collection"),
            average("avg_D_bytes", "docmap_avg_bytes", "average bytes per document in the collection"),
            average("avg_D_terms", "docmap_avg_words", "average terms per document in the collection"),
            average("avg_D_dterms", "docmap_avg_distinct_words", "average distinct terms per document in the collection"),
            average("avg_D_weight", "docmap_avg_weight", "average cosine weight per document in the collection"),
            BuiltinQuantity.of("const unsigned int Q_terms = search_qterms(query);", Level.CONSTANT,
                               "number of terms in the query"),
            BuiltinQuantity.withMacro("const unsigned int Q_dterms;", Level.CONSTANT, "query->terms",
                                      "number of distinct terms in the query"),
            BuiltinQuantity.of("const float Q_weight = search_qweight(query);", Level.CONSTANT,
                               "cosine weight of query"),
            perDocument("const unsigned int D_bytes;", "docmap_get_bytes_cached(idx->map, acc->acc.docno)",
                        "DOCMAP_CACHE_BYTES", "avg_D_bytes", "number of bytes in the current document"),
            perDocument("const unsigned int D_terms;", "DOCMAP_GET_WORDS(idx->map, acc->acc.docno)",
                        "DOCMAP_CACHE_WORDS", "avg_D_terms", "number of terms in the current document"),
            perDocument("const unsigned int D_dterms;", "DOCMAP_GET_DISTINCT_WORDS(idx->map, acc->acc.docno)",
                        "DOCMAP_CACHE_DISTINCT_WORDS", "avg_D_dterms", "number of distinct terms in the current document"),
            perDocument("const float D_weight;", "DOCMAP_GET_WEIGHT(idx->map, acc->acc.docno)",
                        "DOCMAP_CACHE_WEIGHT", "avg_D_weight", "cosine weight of the current document"),
            BuiltinQuantity.withMacro("const unsigned int f_qt;", Level.CONSTANT, "query->term[qterm].f_qt",
                                      "number of times the current term occurred in the query")));

    private final ImmutableList<BuiltinQuantity> quantities;

    public BuiltinQuantities(List<BuiltinQuantity> quantities) {
        this.quantities = ImmutableList.copyOf(quantities);
    }

    /** Returns the quantities supplied by the search engine to every compiled metric */
    public static BuiltinQuantities standard() { return standard; }

    public List<BuiltinQuantity> quantities() { return quantities; }

    /**
     * Declares all quantities of this in the given scopes: decode-only quantities in decode alone,
     * the others in decode and post.
     */
    public void declareIn(Scope decode, Scope post, DeclarationParser parser) throws MetricCompileException {
        for (BuiltinQuantity quantity : quantities) {
            List<Scope> scopes = quantity.decodeOnly() ? List.of(decode) : List.of(decode, post);
            parser.declare(quantity.declaration(), quantity.attributes(), scopes);
        }
    }

    private static BuiltinQuantity average(String name, String docmapFunction, String description) {
        String init = "if (" + docmapFunction + "(idx->map, &" + name + ") != DOCMAP_OK) {\n" +
                      "    return SEARCH_EINVAL;\n" +
                      "}";
        return new BuiltinQuantity("double " + name + ";", Level.CONSTANT, "", init, "", "", description, false);
    }

    private static BuiltinQuantity perDocument(String declaration, String macro, String cacheFlag,
                                               String average, String description) {
        String prerequisite = "if (docmap_cache(idx->map, docmap_get_cache(idx->map) | " + cacheFlag +
                              ") != DOCMAP_OK) return SEARCH_EINVAL;";
        return new BuiltinQuantity(declaration, Level.DOCUMENT, macro, "", prerequisite,
                                   "((float) " + average + ")", description, false);
    }

}
