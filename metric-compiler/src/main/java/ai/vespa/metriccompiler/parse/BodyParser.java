// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.parse;

import ai.vespa.metriccompiler.CompilationContext;
import ai.vespa.metriccompiler.MetricCompileException;
import ai.vespa.metriccompiler.lexer.Token;
import ai.vespa.metriccompiler.lexer.TokenType;
import ai.vespa.metriccompiler.lexer.Tokenizer;
import ai.vespa.metriccompiler.model.Body;
import ai.vespa.metriccompiler.model.Declaration;
import ai.vespa.metriccompiler.model.Level;
import ai.vespa.metriccompiler.model.Statement;
import com.google.common.collect.ImmutableSet;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Reads the contents of a decode or post body: first its local declarations, then its statements,
 * each annotated with the level inferred from the quantities it references.
 *
 * @author mcomp
 */
public class BodyParser {

    private static final Logger log = Logger.getLogger(BodyParser.class.getName());

    private static final ImmutableSet<String> assignmentOperators =
            ImmutableSet.of("=", "+=", "-=", "/=", "*=", "&=", "|=", "^=");

    private final CompilationContext context;
    private final DeclarationParser declarationParser;

    public BodyParser(CompilationContext context, DeclarationParser declarationParser) {
        this.context = context;
        this.declarationParser = declarationParser;
    }

    /** Returns whether the given line closes a function body */
    public static boolean isBodyEnd(String line) {
        return line.stripTrailing().equals("}");
    }

    /**
     * Declares the local quantities at the start of a body in its scope, at level 2.
     * Blank and comment lines are skipped.
     *
     * @return the first line which is not a declaration, blank or a comment
     * @throws MetricCompileException if a declaration is invalid or the input ends
     */
    public String declareLocals(LineReader reader, Body body) throws IOException, MetricCompileException {
        String line = reader.next();
        while (line != null && ! isBodyEnd(line)) {
            String stripped = line.strip();
            if ( ! stripped.isEmpty() && ! stripped.startsWith("#")) {
                List<String> words = Tokenizer.words(line);
                if (words.isEmpty() || ! DeclarationParser.isTypeQualifier(words.get(0))) return line;

                declarationParser.declare(line,
                                          new Declaration.Builder().lineNumber(reader.lineNumber())
                                                                   .level(Level.DOCUMENT)
                                                                   .description("user declared quantity"),
                                          List.of(body.scope()));
            }
            line = reader.next();
        }
        if (line == null)
            throw context.error("unexpected EOF");
        return line;
    }

    /**
     * Adds statements to the body, starting with the given line, until a line closing the body.
     *
     * @return the line closing the body, or null if the input ended first
     * @throws MetricCompileException if the accumulator is read, or a constant built-in is assigned to
     */
    public String levelize(String line, LineReader reader, Body body) throws IOException, MetricCompileException {
        Set<String> unresolved = new TreeSet<>();
        while (line != null && ! isBodyEnd(line)) {
            int startLine = reader.lineNumber();
            List<Token> tokens = Tokenizer.tokenizeSkippingWhitespace(line);
            String stripped = line.strip();

            if (isAssignment(tokens, body)) {
                while ( ! tokens.get(tokens.size() - 1).isTerminator()) {
                    String continuation = reader.next();
                    if (continuation == null)
                        throw context.error("unexpected EOF in " + body.kind().functionName());
                    tokens.addAll(Tokenizer.tokenizeSkippingWhitespace(continuation));
                    line = line.stripTrailing() + " " + continuation.strip();
                }

                String targetName = tokens.get(0).text();
                Declaration target = body.namespace().get(targetName).get();
                if (target.isBuiltin() && target.type().startsWith("const"))
                    throw context.error("assigning to const quantity");

                use(target, body);
                Level level = levelOf(tokens.subList(2, tokens.size()), body, unresolved);
                target.raiseLevel(level);
                body.add(new Statement(startLine, level, line.strip()));
            }
            else if (stripped.startsWith("#")) {
                body.add(Statement.comment(startLine, stripped.substring(1).strip()));
            }
            else if ( ! tokens.isEmpty()) {
                body.add(new Statement(startLine, levelOf(tokens, body, unresolved), stripped));
            }

            line = reader.next();
        }
        if ( ! unresolved.isEmpty())
            log.log(java.util.logging.Level.FINE, () -> "Undeclared identifiers in " + body.kind().functionName() +
                                                        " are passed through unchanged: " + unresolved);
        return line;
    }

    private boolean isAssignment(List<Token> tokens, Body body) {
        return tokens.size() > 2
               && body.namespace().contains(tokens.get(0).text())
               && assignmentOperators.contains(tokens.get(1).text());
    }

    /** Returns the highest level of the declared quantities among the given tokens, marking them as used */
    private Level levelOf(List<Token> operands, Body body, Set<String> unresolved) throws MetricCompileException {
        Level level = Level.CONSTANT;
        for (Token operand : operands) {
            Optional<Declaration> declaration = body.namespace().get(operand.text());
            if (declaration.isEmpty()) {
                if (isIdentifier(operand)) unresolved.add(operand.text());
                continue;
            }
            use(declaration.get(), body);
            if (declaration.get().level() == Level.ACCUMULATOR)
                throw context.error("accumulator used as rvalue");
            level = level.max(declaration.get().level());
        }
        return level;
    }

    /**
     * Marks the given quantity as used in the body. Quantities a decode body uses also need whatever
     * their contribution fallback refers to, as decode code may be emitted with fallbacks substituted.
     */
    private static void use(Declaration declaration, Body body) {
        body.scope().use(declaration.name());
        if (body.kind() != Body.Kind.DECODE) return;
        for (String word : Tokenizer.words(declaration.contribution())) {
            if (body.namespace().contains(word))
                body.scope().use(word);
        }
    }

    private static boolean isIdentifier(Token token) {
        if (token.type() != TokenType.WORD) return false;
        char first = token.text().charAt(0);
        return Character.isLetter(first) || first == '_';
    }

}
