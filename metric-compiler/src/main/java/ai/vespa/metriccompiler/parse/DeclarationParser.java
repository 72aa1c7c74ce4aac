// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.parse;

import ai.vespa.metriccompiler.CompilationContext;
import ai.vespa.metriccompiler.MetricCompileException;
import ai.vespa.metriccompiler.lexer.Token;
import ai.vespa.metriccompiler.lexer.TokenType;
import ai.vespa.metriccompiler.lexer.Tokenizer;
import ai.vespa.metriccompiler.model.Declaration;
import ai.vespa.metriccompiler.model.Level;
import ai.vespa.metriccompiler.model.Scope;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Optional;

/**
 * Parses single-line C declarations such as <code>const float k1 = 1.2; # comment</code>
 * and adds the result to one or more scopes at once.
 *
 * <p>A declaration is a run of type qualifiers, a name, an optional initializer and a
 * terminating ';'. A trailing '#' comment or a complete C block comment is stripped first.
 * Names referenced by the initializer are marked as used in every scope which declares them,
 * and the declared quantity is raised to the highest level among them.</p>
 *
 * @author mcomp
 */
public class DeclarationParser {

    private static final ImmutableSet<String> typeQualifiers =
            ImmutableSet.of("float", "double", "long", "unsigned", "signed", "const", "volatile", "int", "short",
                            "char", "register", "void", "union", "struct", "*", "**", "***", "****");

    private final CompilationContext context;

    public DeclarationParser(CompilationContext context) {
        this.context = context;
    }

    /** Returns whether the given token text is part of a C type rather than a name */
    public static boolean isTypeQualifier(String word) {
        return typeQualifiers.contains(word);
    }

    /** Returns the name declared by the given declaration line, if it has one */
    public static Optional<String> declaredName(String line) {
        List<Token> tokens = Tokenizer.tokenizeSkippingWhitespace(line);
        int nameIndex = skipType(tokens, new StringBuilder());
        if (nameIndex >= tokens.size() || tokens.get(nameIndex).type() != TokenType.WORD) return Optional.empty();
        return Optional.of(tokens.get(nameIndex).text());
    }

    /**
     * Parses a declaration and adds an identical, separate declaration instance to each of the given scopes.
     *
     * @param line the declaration text
     * @param attributes the attributes which are not parsed from the line: level, line number, macro text and so on.
     *                   Name, type, initializer and comment are set by this.
     * @param scopes the scopes to add the declaration to
     * @return the declaration added to the first scope
     * @throws MetricCompileException if the line cannot be parsed, or the name is already declared in any of the scopes
     */
    public Declaration declare(String line, Declaration.Builder attributes, List<Scope> scopes) throws MetricCompileException {
        if (scopes.isEmpty()) throw new IllegalArgumentException("A declaration needs at least one scope");

        String comment = "";
        int hash = line.indexOf('#');
        if (hash >= 0) {
            comment = line.substring(hash + 1);
            line = line.substring(0, hash);
        }
        int commentStart = line.indexOf("/*");
        if (commentStart >= 0) {
            int commentEnd = line.indexOf("*/", commentStart + 2);
            if (commentEnd < 0)
                throw context.error("multiline comment in declaration");
            comment = line.substring(commentStart + 2, commentEnd);
            line = line.substring(0, commentStart) + line.substring(commentEnd + 2);
        }
        line = line.stripTrailing();

        List<Token> tokens = Tokenizer.tokenizeSkippingWhitespace(line);
        StringBuilder type = new StringBuilder();
        int nameIndex = skipType(tokens, type);
        if (nameIndex >= tokens.size() || tokens.get(nameIndex).type() != TokenType.WORD)
            throw context.error("error parsing declaration '" + line.strip() + "'");

        String name = tokens.get(nameIndex).text();
        for (Scope scope : scopes) {
            if (scope.namespace().contains(name))
                throw context.error("duplicate declaration '" + line.strip() + "'");
        }

        int terminatorIndex = tokens.size() - 1;
        if ( ! tokens.get(terminatorIndex).isTerminator())
            throw context.error("declaration without semi-colon ending");

        String initializer = "";
        if (nameIndex + 1 < terminatorIndex) {
            initializer = line.substring(tokens.get(nameIndex + 1).offset());
            initializer = initializer.substring(0, initializer.indexOf(';')).strip();
        }

        List<Token> operands = tokens.subList(nameIndex + 1, terminatorIndex);
        attributes.name(name).type(type.toString().strip()).initializer(initializer).comment(comment);
        Declaration first = null;
        for (Scope scope : scopes) {
            Level operandLevel = useOperands(operands, scope);
            Declaration declaration = attributes.build();
            declaration.raiseLevel(operandLevel);
            scope.namespace().add(declaration);
            if (first == null) first = declaration;
        }
        return first;
    }

    /**
     * Marks the quantities of the scope referenced by an initializer as used,
     * and returns the highest level among them.
     */
    private Level useOperands(List<Token> operands, Scope scope) throws MetricCompileException {
        Level level = Level.CONSTANT;
        for (Token operand : operands) {
            Optional<Declaration> declaration = scope.namespace().get(operand.text());
            if (declaration.isEmpty()) continue;
            if (declaration.get().level() == Level.ACCUMULATOR)
                throw context.error("accumulator used as rvalue");
            scope.use(operand.text());
            level = level.max(declaration.get().level());
        }
        return level;
    }

    /** Appends the type qualifiers at the start of the given tokens to type, and returns the index of the first token after them */
    private static int skipType(List<Token> tokens, StringBuilder type) {
        int i = 0;
        while (i < tokens.size() && isTypeQualifier(tokens.get(i).text())) {
            String qualifier = tokens.get(i++).text();
            type.append(qualifier).append(' ');
            if ((qualifier.equals("struct") || qualifier.equals("union")) && i < tokens.size())
                type.append(tokens.get(i++).text()).append(' ');
        }
        return i;
    }

}
