// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.parse;

import ai.vespa.metriccompiler.CompilationContext;
import ai.vespa.metriccompiler.MetricCompileException;
import ai.vespa.metriccompiler.builtin.BuiltinQuantities;
import ai.vespa.metriccompiler.model.Body;
import ai.vespa.metriccompiler.model.Declaration;
import ai.vespa.metriccompiler.model.Level;
import ai.vespa.metriccompiler.model.MetricDescription;
import ai.vespa.metriccompiler.model.Scope;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a metric description file:
 * <pre>
 * # leading comments, kept for the generated header
 * parameter float k1 = 1.2;
 *
 * decode() {
 *     float w_t;
 *     w_t = log(N / f_t);
 *     accumulator += w_t * f_dt;
 * }
 *
 * post() {
 * }
 * </pre>
 * Parameters and bodies may come in any order. A body ends at a line which is exactly '}'.
 *
 * @author mcomp
 */
public class MetricParser {

    private static final String parameterKeyword = "parameter";
    private static final Pattern bodyStart = Pattern.compile("\\s*(decode|post)\\s*\\(\\s*\\)\\s*\\{\\s*(\\})?\\s*");

    private final CompilationContext context;
    private final BuiltinQuantities builtins;
    private final DeclarationParser declarationParser;
    private final BodyParser bodyParser;

    public MetricParser(CompilationContext context, BuiltinQuantities builtins) {
        this.context = context;
        this.builtins = builtins;
        this.declarationParser = new DeclarationParser(context);
        this.bodyParser = new BodyParser(context, declarationParser);
    }

    /**
     * Parses a description and infers the level of each statement and quantity.
     * Levels are not yet propagated across brace groups.
     *
     * @param source the description text
     * @param metricName the name of the metric, used in parameter macros
     * @throws MetricCompileException on the first error in the description
     */
    public MetricDescription parse(Reader source, String metricName) throws IOException, MetricCompileException {
        Scope parameters = new Scope("parameters");
        Body decode = new Body(Body.Kind.DECODE);
        Body post = new Body(Body.Kind.POST);
        builtins.declareIn(decode.scope(), post.scope(), declarationParser);

        List<String> comments = new ArrayList<>();
        LineReader reader = new LineReader(source, context);
        String line;
        while ((line = reader.next()) != null) {
            String stripped = line.strip();
            String[] words = stripped.isEmpty() ? new String[0] : stripped.split("\\s+");
            Matcher bodyMatcher = bodyStart.matcher(line);

            if (stripped.isEmpty() || stripped.startsWith("#")) {
                if (reader.lineNumber() <= comments.size() + 1) // still in the leading comment block
                    comments.add(stripped.isEmpty() ? "" : stripped.substring(1).strip());
            }
            else if (words.length > 1 && words[0].equals(parameterKeyword)) {
                declareParameter(line.substring(line.indexOf(parameterKeyword) + parameterKeyword.length()),
                                 reader.lineNumber(), metricName, parameters, decode, post);
            }
            else if (bodyMatcher.matches()) {
                Body body = bodyMatcher.group(1).equals("decode") ? decode : post;
                if (bodyMatcher.group(2) == null)
                    parseBody(reader, body);
            }
            else {
                throw context.error("unexpected line: " + line.stripTrailing());
            }
        }

        while ( ! comments.isEmpty() && comments.get(comments.size() - 1).isEmpty())
            comments.remove(comments.size() - 1);
        return new MetricDescription(metricName, comments, parameters, decode, post);
    }

    private void declareParameter(String declaration, int lineNumber, String metricName,
                                  Scope parameters, Body decode, Body post) throws MetricCompileException {
        String name = DeclarationParser.declaredName(declaration).orElse("");
        declarationParser.declare(declaration,
                                  new Declaration.Builder().lineNumber(lineNumber)
                                                           .level(Level.CONSTANT)
                                                           .macro("opt->u." + metricName + "." + name)
                                                           .description("metric parameter"),
                                  List.of(parameters, post.scope(), decode.scope()));
    }

    private void parseBody(LineReader reader, Body body) throws IOException, MetricCompileException {
        String firstStatement = bodyParser.declareLocals(reader, body);
        if (bodyParser.levelize(firstStatement, reader, body) == null)
            throw context.error("unexpected EOF in " + body.kind().functionName());
    }

}
