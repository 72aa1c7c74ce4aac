// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.builtin;

import ai.vespa.metriccompiler.model.Declaration;
import ai.vespa.metriccompiler.model.Level;
import ai.vespa.metriccompiler.parse.DeclarationParser;

import java.util.Objects;

/**
 * A pre-declared collection, query or document statistic available to metric bodies.
 * The values are supplied at run time by the search engine the generated code links against.
 *
 * @param declaration the C declaration of the quantity, e.g. "const unsigned int N = docmap_entries(idx->map);"
 * @param level the level of the quantity
 * @param macro the native expression replacing each use of the name, or empty if the quantity is a variable
 * @param functionInit code initializing the variable when an initializer cannot, or empty
 * @param prerequisite code to run once before the value is first fetched, or empty
 * @param contribution an average-based expression to use when no specific document is at hand, or empty
 * @param description the help text of the quantity
 * @param decodeOnly whether the quantity is only meaningful inside decode bodies
 *
 * @author mcomp
 */
public record BuiltinQuantity(String declaration, Level level, String macro, String functionInit,
                              String prerequisite, String contribution, String description, boolean decodeOnly) {

    public BuiltinQuantity {
        Objects.requireNonNull(declaration);
        Objects.requireNonNull(level);
        Objects.requireNonNull(macro);
        Objects.requireNonNull(functionInit);
        Objects.requireNonNull(prerequisite);
        Objects.requireNonNull(contribution);
        Objects.requireNonNull(description);
    }

    /** Returns a quantity defined by its declaration alone */
    public static BuiltinQuantity of(String declaration, Level level, String description) {
        return new BuiltinQuantity(declaration, level, "", "", "", "", description, false);
    }

    /** Returns a quantity whose uses are replaced by the given native expression */
    public static BuiltinQuantity withMacro(String declaration, Level level, String macro, String description) {
        return new BuiltinQuantity(declaration, level, macro, "", "", "", description, false);
    }

    /** Returns the name this declares */
    public String name() {
        return DeclarationParser.declaredName(declaration)
                                .orElseThrow(() -> new IllegalStateException("No name in '" + declaration + "'"));
    }

    public BuiltinQuantity onlyInDecode() {
        return new BuiltinQuantity(declaration, level, macro, functionInit, prerequisite, contribution, description, true);
    }

    /** Returns the declaration attributes of this, except those parsed from the declaration text */
    public Declaration.Builder attributes() {
        return new Declaration.Builder()
                .lineNumber(Declaration.BUILTIN_LINE)
                .level(level)
                .macro(macro)
                .functionInit(functionInit)
                .prerequisite(prerequisite)
                .contribution(contribution)
                .description(description);
    }

}
