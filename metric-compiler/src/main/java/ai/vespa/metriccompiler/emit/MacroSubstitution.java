// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.emit;

import ai.vespa.metriccompiler.lexer.Token;
import ai.vespa.metriccompiler.lexer.Tokenizer;
import ai.vespa.metriccompiler.model.Declaration;
import ai.vespa.metriccompiler.model.Namespace;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.function.Function;

/**
 * Replaces names by parenthesized native expressions, token by token.
 * This is textual: the same name expands differently depending on the substitution used.
 *
 * @author mcomp
 */
public class MacroSubstitution {

    private final ImmutableMap<String, String> replacements;

    private MacroSubstitution(Map<String, String> replacements) {
        this.replacements = ImmutableMap.copyOf(replacements);
    }

    /** Returns a substitution of each name in the namespace which has a macro by that macro */
    public static MacroSubstitution macros(Namespace namespace) {
        return from(namespace, Declaration::macro);
    }

    /**
     * Returns a substitution of each name in the namespace by its contribution fallback where it has one,
     * and by its macro otherwise.
     */
    public static MacroSubstitution contributions(Namespace namespace) {
        return from(namespace, declaration -> declaration.contribution().isEmpty() ? declaration.macro()
                                                                                  : declaration.contribution());
    }

    private static MacroSubstitution from(Namespace namespace, Function<Declaration, String> replacement) {
        ImmutableMap.Builder<String, String> replacements = ImmutableMap.builder();
        for (Declaration declaration : namespace.declarations()) {
            String text = replacement.apply(declaration);
            if ( ! text.isEmpty())
                replacements.put(declaration.name(), "(" + text + ")");
        }
        return new MacroSubstitution(replacements.build());
    }

    /** Returns the given code with all substituted names replaced. All other text is kept as is. */
    public String apply(String code) {
        StringBuilder b = new StringBuilder();
        for (Token token : Tokenizer.tokenize(code))
            b.append(replacements.getOrDefault(token.text(), token.text()));
        return b.toString();
    }

    public Map<String, String> replacements() { return replacements; }

}
